package win.ixuni.strata.core.exception;

/**
 * 事务回滚失败
 */
public class AbortFailedException extends StrataException {

    public AbortFailedException(String message, Throwable cause) {
        super("AbortFailed", message, cause);
    }
}
