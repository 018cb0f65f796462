package win.ixuni.ferry.core.migration.driver;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Map;

/**
 * Object read from a migration source
 */
@Value
@Builder
public class MigratedObject {

    /**
     * Source metadata. Keys already prefixed {@code X-Object-Meta-} are kept,
     * others get the prefix when the object is written locally.
     */
    @Builder.Default
    Map<String, String> metadata = Map.of();

    /**
     * Size in bytes, -1 when the source did not tell
     */
    @Builder.Default
    long size = -1;

    /**
     * Object data; {@code null} when the source has nothing to migrate under that name
     */
    Flux<ByteBuffer> content;

    String contentType;

    /**
     * Last modification time at the source, may be {@code null}
     */
    Instant timestamp;

    public boolean hasContent() {
        return content != null;
    }

    /**
     * Nothing to migrate, e.g. the name points at a directory
     */
    public static MigratedObject empty() {
        return MigratedObject.builder().build();
    }
}
