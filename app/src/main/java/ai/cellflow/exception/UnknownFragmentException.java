package ai.cellflow.exception;

/** A fragment was passed to a dependency index that does not contain it. */
public class UnknownFragmentException extends RuntimeException {
    public UnknownFragmentException(Object fragment) {
        super("Fragment is not part of this index: " + fragment);
    }
}
