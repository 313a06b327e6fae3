package ai.cellflow.analyzer;

/**
 * How a single name is used by one fragment. The first occurrence decides: a name that is read before it is
 * (re)written ends up {@link #READ_THEN_WRITTEN}, a name written before any read stays {@link #WRITTEN_ONLY} no matter
 * how often it is read afterwards.
 */
public enum SymbolState {
    UNSEEN,
    READ_ONLY,
    WRITTEN_ONLY,
    READ_THEN_WRITTEN;

    public SymbolState onRead() {
        return this == UNSEEN ? READ_ONLY : this;
    }

    /**
     * A read from inside a function or lambda body. The body runs when it is called, not where it is defined, so the
     * read counts even if this fragment already wrote the name.
     */
    public SymbolState onDeferredRead() {
        return switch (this) {
            case UNSEEN -> READ_ONLY;
            case WRITTEN_ONLY -> READ_THEN_WRITTEN;
            case READ_ONLY, READ_THEN_WRITTEN -> this;
        };
    }

    public SymbolState onWrite() {
        return switch (this) {
            case UNSEEN -> WRITTEN_ONLY;
            case READ_ONLY -> READ_THEN_WRITTEN;
            case WRITTEN_ONLY, READ_THEN_WRITTEN -> this;
        };
    }

    /** The fragment consumes this name from the environment. */
    public boolean isRead() {
        return this == READ_ONLY || this == READ_THEN_WRITTEN;
    }

    /** The fragment leaves a (new or mutated) value for this name in the environment. */
    public boolean isWritten() {
        return this == WRITTEN_ONLY || this == READ_THEN_WRITTEN;
    }
}
