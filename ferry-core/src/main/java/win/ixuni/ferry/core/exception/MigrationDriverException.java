package win.ixuni.ferry.core.exception;

/**
 * Error signalled by a migration driver (bad parameters, connection failure,
 * remote object missing).
 */
public class MigrationDriverException extends FerryException {

    public MigrationDriverException(String message) {
        super("MigrationDriverError", message, 404);
    }

    public MigrationDriverException(String message, Throwable cause) {
        super("MigrationDriverError", message, 404, cause);
    }
}
