package tree.ukkonen;

// Lifecycle of a suffix tree. Transitions only move forward.
public enum TreeState {
    EMPTY,
    IMPLICIT,
    EXPLICIT,
    INDEXED;

    boolean isExplicit() {
        return this == EXPLICIT || this == INDEXED;
    }
}
