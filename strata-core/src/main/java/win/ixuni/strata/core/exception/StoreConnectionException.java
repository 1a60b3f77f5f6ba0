package win.ixuni.strata.core.exception;

/**
 * 无法建立到存储的连接或会话
 */
public class StoreConnectionException extends StrataException {

    public StoreConnectionException(String target, Throwable cause) {
        super("ConnectionFailed", "Error while connecting to " + target + ": " + cause.getMessage(), cause);
    }
}
