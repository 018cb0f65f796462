package win.ixuni.ferry.core.constraints;

import lombok.Getter;
import win.ixuni.ferry.core.config.FerryProperties;
import win.ixuni.ferry.core.exception.BadRequestException;
import win.ixuni.ferry.core.exception.EntityTooLargeException;
import win.ixuni.ferry.core.exception.FerryException;

import java.util.Optional;

/**
 * 对象创建约束
 * <p>
 * Name length and size limits applied to every object the proxy writes on its own behalf.
 */
@Getter
public class ObjectConstraints implements ObjectCreationValidator {

    private final int maxObjectNameLength;
    private final long maxFileSize;

    public ObjectConstraints(int maxObjectNameLength, long maxFileSize) {
        this.maxObjectNameLength = maxObjectNameLength;
        this.maxFileSize = maxFileSize;
    }

    public ObjectConstraints(FerryProperties.ConstraintsConfig config) {
        this(config.getMaxObjectNameLength(), config.getMaxFileSize());
    }

    @Override
    public Optional<FerryException> validate(String objectName, long contentLength) {
        if (objectName == null || objectName.isEmpty()) {
            return Optional.of(new BadRequestException("Object name is missing"));
        }
        if (objectName.length() > maxObjectNameLength) {
            return Optional.of(new BadRequestException(String.format(
                    "Object name length of %d longer than %d", objectName.length(), maxObjectNameLength)));
        }
        if (contentLength > maxFileSize) {
            return Optional.of(new EntityTooLargeException("Your request is too large."));
        }
        return Optional.empty();
    }
}
