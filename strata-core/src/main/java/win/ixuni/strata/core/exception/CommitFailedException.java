package win.ixuni.strata.core.exception;

/**
 * Definitive commit failure, never retried
 */
public class CommitFailedException extends StrataException {

    public CommitFailedException(String message, Throwable cause) {
        super("CommitFailed", message, cause);
    }

    protected CommitFailedException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
