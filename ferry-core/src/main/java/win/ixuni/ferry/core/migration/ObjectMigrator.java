package win.ixuni.ferry.core.migration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.constraints.ObjectCreationValidator;
import win.ixuni.ferry.core.exception.EntityTooLargeException;
import win.ixuni.ferry.core.exception.MigrationDriverException;
import win.ixuni.ferry.core.exception.MigrationException;
import win.ixuni.ferry.core.http.MetadataHeaders;
import win.ixuni.ferry.core.http.ProxyHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.http.RequestPath;
import win.ixuni.ferry.core.migration.driver.MigratedObject;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.util.BodyUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 对象迁移
 * <p>
 * Fetches one object through a driver and writes it to the local backend
 * with a PUT sub-request.
 */
@Slf4j
@RequiredArgsConstructor
public class ObjectMigrator {

    private static final List<String> FORWARDED_HEADERS = List.of("X-Auth-Token", HttpHeaders.AUTHORIZATION);

    private final ObjectCreationValidator validator;
    private final Clock clock;

    public ObjectMigrator(ObjectCreationValidator validator) {
        this(validator, Clock.systemUTC());
    }

    /**
     * @param objectPath where the object is written
     * @param request    the client request that missed
     * @param driver     driver of the container's source
     * @param origin     {@code provider:source}, recorded on the object
     * @return status of the local PUT, always 2xx; any other outcome is an error
     */
    public Mono<Integer> migrate(RequestPath objectPath, ProxyRequest request, MigrationDriver driver,
                                 String origin, ProxyHandler next) {
        return driver.fetch(objectPath.getObject())
                .onErrorMap(MigrationDriverException.class, e -> new MigrationException(e.getMessage(), e))
                .switchIfEmpty(Mono.error(() -> new MigrationException(
                        "Object " + objectPath.getObject() + " not found in migration source")))
                .flatMap(object -> {
                    if (!object.hasContent()) {
                        return Mono.error(new MigrationException(
                                "Object " + objectPath.getObject() + " not found in migration source"));
                    }
                    return withKnownLength(objectPath.getObject(), object);
                })
                .flatMap(object -> upload(objectPath, request, object, origin, next));
    }

    /**
     * Rejects a declared size over the limit before reading; a body of unknown
     * size is buffered up to the limit only
     */
    private Mono<MigratedObject> withKnownLength(String objectName, MigratedObject object) {
        var violation = validator.validate(objectName, object.getSize());
        if (violation.isPresent()) {
            BodyUtils.discard(object.getContent());
            return Mono.error(violation.get());
        }
        if (object.getSize() >= 0) {
            return Mono.just(object);
        }
        return BodyUtils.join(object.getContent(), validator.getMaxFileSize(),
                        () -> new EntityTooLargeException("Your request is too large."))
                .map(bytes -> MigratedObject.builder()
                        .metadata(object.getMetadata())
                        .size(bytes.length)
                        .content(BodyUtils.of(bytes))
                        .contentType(object.getContentType())
                        .timestamp(object.getTimestamp())
                        .build());
    }

    private Mono<Integer> upload(RequestPath objectPath, ProxyRequest request, MigratedObject object,
                                 String origin, ProxyHandler next) {
        return Mono.defer(() -> {
            HttpHeaders headers = buildHeaders(request, object, origin);
            ProxyRequest put = request.subRequest("PUT", objectPath.toPath(), headers, ContainerMetadataLookup.SOURCE_TAG);
            put.getQueryParams().clear();
            put.setBody(object.getContent());

            log.info("Migrating {} from {} ({} bytes)", objectPath, origin, object.getSize());
            return next.handle(put).flatMap(this::checkUpload);
        });
    }

    HttpHeaders buildHeaders(ProxyRequest request, MigratedObject object, String origin) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : FORWARDED_HEADERS) {
            List<String> values = request.getHeaders().get(name);
            if (values != null) {
                headers.put(name, values);
            }
        }

        String userPrefix = MetadataHeaders.userMetaPrefix(MetadataHeaders.OBJECT);
        for (Map.Entry<String, String> entry : object.getMetadata().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (!key.startsWith(userPrefix)) {
                key = userPrefix + key;
            }
            headers.set(key, entry.getValue());
        }

        Instant now = clock.instant();
        Instant timestamp = now;
        if (object.getTimestamp() != null && object.getTimestamp().isBefore(now)) {
            timestamp = object.getTimestamp();
        }
        headers.set(ProxyHeaders.X_TIMESTAMP, ProxyHeaders.formatTimestamp(timestamp));
        headers.set(ProxyHeaders.X_OBJECT_SYSMETA_MIGRATION_TIMESTAMP, ProxyHeaders.formatTimestamp(now));
        headers.set(ProxyHeaders.X_OBJECT_SYSMETA_MIGRATION_ORIGIN, origin);

        if (StringUtils.hasText(object.getContentType())) {
            headers.set(HttpHeaders.CONTENT_TYPE, object.getContentType());
        }
        headers.setContentLength(object.getSize());
        return headers;
    }

    private Mono<Integer> checkUpload(ProxyResponse response) {
        int status = response.getStatus();
        if (status == 200 || status == 201 || status == 202) {
            return Mono.just(status);
        }
        return Mono.error(new MigrationException("Failed to create local object. Status " + status));
    }
}
