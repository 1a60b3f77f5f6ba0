package win.ixuni.strata.core.exception;

import lombok.Getter;

/**
 * Strata base exception
 */
@Getter
public class StrataException extends RuntimeException {

    private final String errorCode;

    public StrataException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StrataException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
