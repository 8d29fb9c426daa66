package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * A side table from arena-registered nodes to values.
 */
public final class NodeTable<V> {

    private final NodeArena arena;
    private final List<V> values = new ArrayList<>();

    public NodeTable(NodeArena arena) {
        this.arena = arena;
    }

    public V get(Node node) {
        return getAt(arena.indexOf(node));
    }

    public V getAt(int index) {
        if (index < 0 || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }

    public boolean containsKey(Node node) {
        return get(node) != null;
    }

    public void put(Node node, V value) {
        int index = arena.register(node);
        while (values.size() <= index) {
            values.add(null);
        }
        values.set(index, value);
    }

    public V computeIfAbsent(Node node, Supplier<V> factory) {
        V value = get(node);
        if (value == null) {
            value = factory.get();
            put(node, value);
        }
        return value;
    }
}
