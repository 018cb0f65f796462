package win.ixuni.ferry.core.exception;

import lombok.Getter;

/**
 * Ferry base exception
 * <p>
 * Carries the HTTP status the proxy answers with when the exception reaches
 * the error translation middleware.
 */
@Getter
public class FerryException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public FerryException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public FerryException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
