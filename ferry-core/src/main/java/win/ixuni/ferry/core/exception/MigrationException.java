package win.ixuni.ferry.core.exception;

/**
 * 迁移失败
 * <p>
 * Driver resolution, fetch or upload failed. The client only ever sees the
 * original 404 plus a diagnostic header.
 */
public class MigrationException extends FerryException {

    public MigrationException(String message) {
        super("MigrationFailed", message, 404);
    }

    public MigrationException(String message, Throwable cause) {
        super("MigrationFailed", message, 404, cause);
    }
}
