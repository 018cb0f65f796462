package win.ixuni.ferry.driver.local;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.ferry.core.exception.MigrationDriverException;
import win.ixuni.ferry.core.migration.driver.MigratedObject;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 本地文件系统迁移驱动
 * <p>
 * Migrates files below {@code parent-path}. The container's migration
 * source names a sub-folder of it: with {@code parent-path=/home} and source
 * {@code vacation/images}, object {@code a.jpg} is read from
 * {@code /home/vacation/images/a.jpg}.
 */
@Slf4j
public class LocalMigrationDriver implements MigrationDriver {

    public static final String PARENT_PATH = "parent-path";

    private final Path dataSource;

    public LocalMigrationDriver(String source, MigrationParameters params) {
        String rootPath = params.get(PARENT_PATH);
        if (rootPath == null) {
            throw new MigrationDriverException(PARENT_PATH + " parameter should be configured");
        }
        if (!isValidPath(rootPath)) {
            throw new MigrationDriverException(PARENT_PATH + ": " + rootPath + " is invalid");
        }
        if (source == null || !isValidPath(source)) {
            throw new MigrationDriverException("Migration source " + source + " is invalid");
        }
        String relative = source.startsWith("/") ? source.substring(1) : source;
        this.dataSource = Paths.get(rootPath).resolve(relative);
    }

    private static boolean isValidPath(String path) {
        return !path.isBlank() && !path.contains("..");
    }

    @Override
    public Mono<MigratedObject> fetch(String objectName) {
        return Mono.fromCallable(() -> {
                    Path file = dataSource.resolve(objectName).normalize();
                    if (!file.startsWith(dataSource.normalize())) {
                        throw new MigrationDriverException("Object name " + objectName + " is invalid");
                    }
                    return read(file);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private MigratedObject read(Path file) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new MigrationDriverException("Failed to access object in file system", e);
        }
        if (attrs.isDirectory()) {
            return MigratedObject.empty();
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        readOwner(file, metadata);
        readExtendedAttributes(file, metadata);

        byte[] data;
        String contentType;
        try {
            data = Files.readAllBytes(file);
            contentType = Files.probeContentType(file);
        } catch (IOException e) {
            throw new MigrationDriverException("Failed to access object in file system", e);
        }
        log.debug("Read {} ({} bytes) from file system", file, data.length);

        return MigratedObject.builder()
                .metadata(metadata)
                .size(data.length)
                .content(Flux.just(ByteBuffer.wrap(data)))
                .contentType(contentType)
                .timestamp(attrs.lastModifiedTime().toInstant())
                .build();
    }

    private void readOwner(Path file, Map<String, String> metadata) {
        try {
            Object uid = Files.getAttribute(file, "unix:uid");
            Object gid = Files.getAttribute(file, "unix:gid");
            metadata.put("uid", String.valueOf(uid));
            metadata.put("gid", String.valueOf(gid));
        } catch (UnsupportedOperationException | IllegalArgumentException | IOException e) {
            log.trace("No unix attributes for {}: {}", file, e.getMessage());
        }
    }

    private void readExtendedAttributes(Path file, Map<String, String> metadata) {
        UserDefinedFileAttributeView view = Files.getFileAttributeView(file, UserDefinedFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            for (String name : view.list()) {
                ByteBuffer buffer = ByteBuffer.allocate(view.size(name));
                view.read(name, buffer);
                buffer.flip();
                metadata.put(name, StandardCharsets.UTF_8.decode(buffer).toString());
            }
        } catch (IOException | UnsupportedOperationException e) {
            log.trace("No extended attributes for {}: {}", file, e.getMessage());
        }
    }

    Path getDataSource() {
        return dataSource;
    }
}
