package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run registry giving every visited node a dense index. Relations between nodes are kept
 * in {@link NodeTable}s addressed by that index instead of identity hash maps.
 * <p>
 * A node holds one arena slot at a time: registering it in a newer arena invalidates it in the
 * older one, which then reports it as unknown.
 */
public final class NodeArena {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.incrementAndGet();
    private final List<Node> nodes = new ArrayList<>();

    public int register(Node node) {
        int index = indexOf(node);
        if (index >= 0) {
            return index;
        }
        index = nodes.size();
        nodes.add(node);
        node.setArenaSlot(id, index);
        return index;
    }

    /**
     * Returns the index of the node in this arena, or -1 when it was never registered here.
     */
    public int indexOf(Node node) {
        if (node == null || node.getArenaId() != id) {
            return -1;
        }
        int index = node.getArenaIndex();
        return index < nodes.size() && nodes.get(index) == node ? index : -1;
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }
}
