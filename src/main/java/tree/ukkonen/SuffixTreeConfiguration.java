package tree.ukkonen;

// Immutable configuration for constructing suffix trees.
public final class SuffixTreeConfiguration {

    public static final int DEFAULT_TERMINATOR = '$';
    public static final int DEFAULT_INITIAL_CAPACITY = 16;

    private final int terminator;
    private final int initialCapacity;
    private final boolean traceConstruction;

    private SuffixTreeConfiguration(Builder builder) {
        this.terminator = builder.terminator;
        this.initialCapacity = builder.initialCapacity;
        this.traceConstruction = builder.traceConstruction;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() {
        return builder().build();
    }

    private void validate() {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
    }

    public int terminator() { return terminator; }
    public int initialCapacity() { return initialCapacity; }
    public boolean traceConstruction() { return traceConstruction; }

    public Builder toBuilder() {
        return builder()
                .terminator(terminator)
                .initialCapacity(initialCapacity)
                .traceConstruction(traceConstruction);
    }

    public static final class Builder {
        private int terminator = DEFAULT_TERMINATOR;
        private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
        private boolean traceConstruction;

        private Builder() {
        }

        public Builder terminator(int terminator) {
            this.terminator = terminator;
            return this;
        }

        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder traceConstruction(boolean traceConstruction) {
            this.traceConstruction = traceConstruction;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
