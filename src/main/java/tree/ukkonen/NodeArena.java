package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Arrays;
import java.util.function.IntConsumer;

/**
 * Append-only node table of a suffix tree.
 *
 * Nodes are addressed by integer handles and stored column-wise. A node's incoming edge is
 * labelled by the inclusive range {@code [start, end]} of the symbol sequence; open leaves
 * keep {@link #LEAF_END} as their end and resolve it through the tree's single {@link LeafEnd}.
 * Handles stay valid for the lifetime of the tree because nothing is ever removed.
 */
final class NodeArena {

    static final int NO_NODE = -1;
    static final int LEAF_END = Integer.MIN_VALUE;
    static final int ROOT = 0;

    private final IntArrayList starts;
    private final IntArrayList ends;
    private final IntArrayList suffixLinks;
    private final IntArrayList suffixIndices;
    // LAZY: null until the node gets its first child
    private final ObjectArrayList<Int2IntOpenHashMap> children;

    NodeArena(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        // a tree over n symbols has at most 2n + 1 nodes
        int capacity = initialCapacity * 2 + 1;
        this.starts = new IntArrayList(capacity);
        this.ends = new IntArrayList(capacity);
        this.suffixLinks = new IntArrayList(capacity);
        this.suffixIndices = new IntArrayList(capacity);
        this.children = new ObjectArrayList<>(capacity);

        int root = newNode(-1, -1);
        suffixLinks.set(root, root);
    }

    int newNode(int start, int end) {
        int handle = starts.size();
        starts.add(start);
        ends.add(end);
        suffixLinks.add(NO_NODE);
        suffixIndices.add(-1);
        children.add(null);
        return handle;
    }

    int newLeaf(int start) {
        return newNode(start, LEAF_END);
    }

    int size() {
        return starts.size();
    }

    int child(int node, int symbol) {
        Int2IntOpenHashMap map = children.get(node);
        return (map == null) ? NO_NODE : map.get(symbol);
    }

    void setChild(int node, int symbol, int child) {
        Int2IntOpenHashMap map = children.get(node);
        if (map == null) {
            map = new Int2IntOpenHashMap(4);
            map.defaultReturnValue(NO_NODE);
            children.set(node, map);
        }
        map.put(symbol, child);
    }

    int childCount(int node) {
        Int2IntOpenHashMap map = children.get(node);
        return (map == null) ? 0 : map.size();
    }

    boolean isLeaf(int node) {
        return node != ROOT && childCount(node) == 0;
    }

    void forEachChild(int node, IntConsumer consumer) {
        Int2IntOpenHashMap map = children.get(node);
        if (map == null) {
            return;
        }
        IntIterator it = map.values().iterator();
        while (it.hasNext()) {
            consumer.accept(it.nextInt());
        }
    }

    /** Child handles of {@code node}, ordered by the first symbol of their edge. */
    int[] sortedChildren(int node) {
        Int2IntOpenHashMap map = children.get(node);
        if (map == null) {
            return new int[0];
        }
        int[] keys = map.keySet().toIntArray();
        Arrays.sort(keys);
        int[] out = new int[keys.length];
        for (int i = 0; i < keys.length; i++) {
            out[i] = map.get(keys[i]);
        }
        return out;
    }

    int start(int node) {
        return starts.getInt(node);
    }

    void setStart(int node, int start) {
        starts.set(node, start);
    }

    boolean isOpen(int node) {
        return ends.getInt(node) == LEAF_END;
    }

    int effectiveEnd(int node, LeafEnd leafEnd) {
        int end = ends.getInt(node);
        return (end == LEAF_END) ? leafEnd.get() : end;
    }

    int edgeLength(int node, LeafEnd leafEnd) {
        if (node == ROOT) {
            return 0;
        }
        return effectiveEnd(node, leafEnd) - start(node) + 1;
    }

    int suffixLink(int node) {
        return suffixLinks.getInt(node);
    }

    void setSuffixLink(int node, int target) {
        suffixLinks.set(node, target);
    }

    int suffixIndex(int node) {
        return suffixIndices.getInt(node);
    }

    void setSuffixIndex(int node, int index) {
        suffixIndices.set(node, index);
    }

    void checkHandle(int node) {
        if (node < 0 || node >= size()) {
            throw new IllegalArgumentException("unknown node handle: " + node);
        }
    }

    /** Shrink every column and child map to its exact size. Call once no more symbols arrive. */
    void trimToSize() {
        starts.trim();
        ends.trim();
        suffixLinks.trim();
        suffixIndices.trim();
        children.trim();
        for (Int2IntOpenHashMap map : children) {
            if (map != null) {
                map.trim();
            }
        }
    }
}
