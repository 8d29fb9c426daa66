package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class of every C syntax tree node.
 * <p>
 * Nodes expose their fields publicly, the same way the bytecode tree nodes do, so that
 * transforms can rewrite them in place. The ordered child view returned by {@link #children()}
 * carries a setter per child, which is how generic passes replace a subtree without knowing
 * which field holds it.
 */
public abstract class Node {

    private int arenaId = -1;
    private int arenaIndex = -1;

    public abstract NodeKind kind();

    /**
     * Appends the non-null children of this node, in source order.
     */
    protected abstract void collectChildren(Children out);

    /**
     * Creates a deep copy of this subtree. Arena registration is not copied.
     */
    public abstract Node copy();

    public final List<Child> children() {
        Children out = new Children();
        collectChildren(out);
        return out.toList();
    }

    public int getArenaId() {
        return arenaId;
    }

    public int getArenaIndex() {
        return arenaIndex;
    }

    public void setArenaSlot(int arenaId, int arenaIndex) {
        this.arenaId = arenaId;
        this.arenaIndex = arenaIndex;
    }

    @SuppressWarnings("unchecked")
    public static <T extends Node> T copyOf(T node) {
        return node == null ? null : (T) node.copy();
    }

    public static <T extends Node> List<T> copyAll(List<T> nodes) {
        if (nodes == null) {
            return null;
        }
        List<T> result = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            result.add(copyOf(node));
        }
        return result;
    }

    @Override
    public String toString() {
        return kind().name();
    }
}
