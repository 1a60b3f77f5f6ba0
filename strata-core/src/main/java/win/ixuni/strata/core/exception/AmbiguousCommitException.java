package win.ixuni.strata.core.exception;

/**
 * The store could not confirm whether a commit took effect
 * <p>
 * Drivers raise it from {@code TransactionSession.commitTransaction()}; the unit of work retries the commit.
 */
public class AmbiguousCommitException extends StrataException {

    public AmbiguousCommitException(String message, Throwable cause) {
        super("UnknownCommitResult", message, cause);
    }
}
