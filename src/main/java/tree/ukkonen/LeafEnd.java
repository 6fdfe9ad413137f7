package tree.ukkonen;

/**
 * Shared end position of every open leaf edge.
 *
 * Open leaves do not store a private end; they carry {@link NodeArena#LEAF_END} and read this
 * cell instead. Ukkonen's algorithm advances it exactly once per phase, which extends every
 * open leaf in O(1).
 */
final class LeafEnd {
    private int value;

    LeafEnd() {
        this.value = -1;
    }

    int get() {
        return value;
    }

    // Only the phase driver calls this, once per phase.
    void advanceTo(int pos) {
        if (pos < value) {
            throw new IllegalStateException("leaf end cannot move backwards: " + value + " -> " + pos);
        }
        value = pos;
    }
}
