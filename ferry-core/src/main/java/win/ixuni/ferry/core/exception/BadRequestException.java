package win.ixuni.ferry.core.exception;

/**
 * 400 Bad Request
 */
public class BadRequestException extends FerryException {

    public BadRequestException(String message) {
        super("BadRequest", message, 400);
    }
}
