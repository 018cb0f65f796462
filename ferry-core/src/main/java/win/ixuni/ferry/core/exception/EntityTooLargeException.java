package win.ixuni.ferry.core.exception;

/**
 * 413 Request Entity Too Large
 */
public class EntityTooLargeException extends FerryException {

    public EntityTooLargeException(String message) {
        super("EntityTooLarge", message, 413);
    }
}
