package win.ixuni.ferry.core.constraints;

import win.ixuni.ferry.core.exception.FerryException;

import java.util.Optional;

/**
 * Checks whether an object may be created
 */
@FunctionalInterface
public interface ObjectCreationValidator {

    /**
     * @param objectName    decoded object name
     * @param contentLength declared length, -1 when unknown
     * @return the violation, empty when the object may be created
     */
    Optional<FerryException> validate(String objectName, long contentLength);

    /**
     * Upper bound used when a body of unknown length has to be read
     */
    default long getMaxFileSize() {
        return Long.MAX_VALUE;
    }
}
