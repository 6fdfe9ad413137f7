package tree.ukkonen;

/**
 * Contract violation on a {@link SuffixTree}: an operation called in the wrong lifecycle state,
 * or a terminator that already occurs in the text. Raised before any mutation, so the tree is
 * unchanged when this is thrown.
 */
public class SuffixTreeException extends IllegalStateException {

    public enum ErrorKind {
        INVALID_TERMINATOR,
        NOT_FINALIZED,
        NOT_INDEXED,
        ALREADY_FINALIZED
    }

    private final ErrorKind kind;

    public SuffixTreeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
