package win.ixuni.ferry.core.exception;

/**
 * 412 Precondition Failed
 * <p>
 * Raised for malformed or missing copy/migration setup headers.
 */
public class PreconditionFailedException extends FerryException {

    public PreconditionFailedException(String message) {
        super("PreconditionFailed", message, 412);
    }
}
