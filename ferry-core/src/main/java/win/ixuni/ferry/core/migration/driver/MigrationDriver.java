package win.ixuni.ferry.core.migration.driver;

import reactor.core.publisher.Mono;

/**
 * 迁移驱动
 * <p>
 * Reads objects from one external source (a folder, a bucket, a remote
 * container). One instance serves one migration attempt and is closed
 * afterwards, whether the attempt succeeded or not.
 */
public interface MigrationDriver {

    /**
     * Read an object from the source
     *
     * @param objectName object name relative to the source
     * @return the object; errors are signalled as
     *         {@link win.ixuni.ferry.core.exception.MigrationDriverException}
     */
    Mono<MigratedObject> fetch(String objectName);

    /**
     * Release whatever {@link #fetch} opened
     */
    default void close() {
    }
}
