package tree.ukkonen;

/**
 * Cursor of Ukkonen's algorithm: where the next pending suffix diverges from the tree built so
 * far, together with the number of suffixes still waiting for explicit insertion.
 *
 * The value is handed to {@link PhaseExtender#extend(int, ActivePoint)} for every phase, so a
 * phase can be replayed from a {@link #snapshot()}.
 */
public final class ActivePoint {
    int node;
    // index into the symbol sequence naming the first symbol of the active edge
    int edge;
    int length;
    int remaining;

    ActivePoint() {
        this(NodeArena.ROOT, -1, 0, 0);
    }

    private ActivePoint(int node, int edge, int length, int remaining) {
        this.node = node;
        this.edge = edge;
        this.length = length;
        this.remaining = remaining;
    }

    public int node() {
        return node;
    }

    public int edge() {
        return edge;
    }

    public int length() {
        return length;
    }

    public int remaining() {
        return remaining;
    }

    public ActivePoint snapshot() {
        return new ActivePoint(node, edge, length, remaining);
    }

    /**
     * Skip/count: if the active length covers the whole edge into {@code child}, move the cursor
     * to {@code child} and return true; otherwise leave it inside the edge and return false.
     */
    boolean walkDown(NodeArena arena, LeafEnd leafEnd, int child) {
        int edgeLength = arena.edgeLength(child, leafEnd);
        if (length >= edgeLength) {
            edge += edgeLength;
            length -= edgeLength;
            node = child;
            return true;
        }
        return false;
    }

    /** Move to the start of the next shorter suffix after one explicit extension at {@code pos}. */
    void afterExtension(NodeArena arena, int pos) {
        if (node == NodeArena.ROOT && length > 0) {
            length--;
            edge = pos - remaining + 1;
        } else if (node != NodeArena.ROOT) {
            int link = arena.suffixLink(node);
            node = (link != NodeArena.NO_NODE) ? link : NodeArena.ROOT;
        }
    }

    @Override
    public String toString() {
        return "ActivePoint{node=" + node + ", edge=" + edge + ", length=" + length
                + ", remaining=" + remaining + '}';
    }
}
