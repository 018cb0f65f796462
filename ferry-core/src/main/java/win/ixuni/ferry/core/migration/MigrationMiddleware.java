package win.ixuni.ferry.core.migration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.exception.BadRequestException;
import win.ixuni.ferry.core.exception.MigrationException;
import win.ixuni.ferry.core.exception.PreconditionFailedException;
import win.ixuni.ferry.core.http.ProxyHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.http.RequestPath;
import win.ixuni.ferry.core.migration.driver.DriverRegistration;
import win.ixuni.ferry.core.migration.driver.MigrationDriverRegistry;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.pipeline.ProxyMiddleware;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 按需数据迁移
 * <p>
 * Two jobs:
 * <ol>
 *   <li>Container PUT/POST: validate the {@code X-Container-Migration-*}
 *   setup headers and mirror them into container system metadata.</li>
 *   <li>Object GET/HEAD answered 404 in a container with active migration:
 *   fetch the object through the container's driver, store it locally and
 *   replay the request.</li>
 * </ol>
 * A failed migration is answered with a 404 (or 400 for validation-style
 * failures) carrying {@code X-Migration-Status}.
 */
@Slf4j
public class MigrationMiddleware implements ProxyMiddleware {

    private static final List<String> REFLECTED = List.of("Provider", "Source", "Active");

    private final MigrationDriverRegistry registry;
    private final ContainerMetadataLookup metadataLookup;
    private final ObjectMigrator objectMigrator;

    public MigrationMiddleware(MigrationDriverRegistry registry, ContainerMetadataLookup metadataLookup,
                               ObjectMigrator objectMigrator) {
        this.registry = registry;
        this.metadataLookup = metadataLookup;
        this.objectMigrator = objectMigrator;
    }

    @Override
    public Mono<ProxyResponse> intercept(ProxyRequest request, ProxyHandler next) {
        return Mono.defer(() -> handleRequest(request, next));
    }

    private Mono<ProxyResponse> handleRequest(ProxyRequest request, ProxyHandler next) {
        Optional<RequestPath> parsed = request.getRequestPath();
        if (parsed.isEmpty() || parsed.get().getContainer() == null) {
            return next.handle(request);
        }
        RequestPath path = parsed.get();

        if (path.isContainer() && ("PUT".equals(request.getMethod()) || "POST".equals(request.getMethod()))) {
            validateSetup(request.getHeaders());
            mirrorSetupHeaders(request.getHeaders());
        }

        // later middlewares rewrite the request in place
        ProxyRequest original = request.copy();

        return next.handle(request)
                .map(this::reflectMigrationHeaders)
                .flatMap(response -> {
                    if (response.getStatus() != 404 || !isMigrationCandidate(original, path)) {
                        return Mono.just(response);
                    }
                    return metadataLookup.lookup(path, original, next)
                            .flatMap(metadata -> {
                                if (!ProxyHeaders.isTrue(metadata.get(MigrationDriverRegistry.ACTIVE))) {
                                    return Mono.just(response);
                                }
                                return migrateAndReplay(path, original, metadata, next)
                                        .doOnNext(replayed -> response.discardBody())
                                        .onErrorResume(e -> migrationFailed(path, response, e));
                            });
                });
    }

    private boolean isMigrationCandidate(ProxyRequest original, RequestPath path) {
        if (original.getHeaders().containsKey(ProxyHeaders.X_CONTAINER_MIGRATION_PROVIDER)) {
            return false;
        }
        String method = original.getMethod();
        return path.isObject() && ("GET".equals(method) || "HEAD".equals(method));
    }

    private Mono<ProxyResponse> migrateAndReplay(RequestPath path, ProxyRequest original,
                                                 Map<String, String> metadata, ProxyHandler next) {
        String origin = metadata.getOrDefault(MigrationDriverRegistry.PROVIDER, "").toLowerCase(Locale.ROOT)
                + ":" + metadata.getOrDefault(MigrationDriverRegistry.SOURCE, "").toLowerCase(Locale.ROOT);

        return Mono.usingWhen(
                        Mono.fromCallable(() -> registry.resolve(metadata)),
                        driver -> objectMigrator.migrate(path, original, driver, origin, next),
                        driver -> Mono.fromRunnable(driver::close))
                .flatMap(status -> {
                    log.info("Migrated {} from {}, replaying {}", path, origin, original.getMethod());
                    return next.handle(original.copy());
                })
                .map(this::reflectMigrationHeaders);
    }

    private Mono<ProxyResponse> migrationFailed(RequestPath path, ProxyResponse notFound, Throwable e) {
        log.error("Migration of {} failed: {}", path, e.getMessage());
        String status = String.valueOf(e.getMessage());
        if (e instanceof MigrationException) {
            notFound.getHeaders().set(ProxyHeaders.X_MIGRATION_STATUS, status);
            return Mono.just(notFound);
        }
        notFound.discardBody();
        ProxyResponse badRequest = ProxyResponse.text(400, status);
        badRequest.getHeaders().set(ProxyHeaders.X_MIGRATION_STATUS, status);
        return Mono.just(badRequest);
    }

    /**
     * @throws PreconditionFailedException when provider, source or active flag is missing
     * @throws BadRequestException         when the provider cannot be used
     */
    void validateSetup(HttpHeaders headers) {
        String provider = headers.getFirst(ProxyHeaders.X_CONTAINER_MIGRATION_PROVIDER);
        String source = headers.getFirst(ProxyHeaders.X_CONTAINER_MIGRATION_SOURCE);

        if (!StringUtils.hasText(source) && provider != null) {
            throw new PreconditionFailedException("Migration source is missing");
        }
        if (!StringUtils.hasText(provider) && source != null) {
            throw new PreconditionFailedException("Migration provider is missing");
        }
        if (provider == null) {
            // no setup in this request, or only the active flag toggled
            return;
        }
        if (!StringUtils.hasText(headers.getFirst(ProxyHeaders.X_CONTAINER_MIGRATION_ACTIVE))) {
            throw new PreconditionFailedException("Migration active flag is missing");
        }

        DriverRegistration registration = registry.find(provider)
                .orElseThrow(() -> new BadRequestException("Invalid provider"));
        if (!registration.isDriverLoaded()) {
            throw new BadRequestException("Invalid access driver");
        }
        for (String key : registration.getRequiredKeys()) {
            String header = keyHeader(key);
            if (headers.getFirst(header) == null) {
                throw new BadRequestException("Missing required header: " + header);
            }
        }
        registration.getStaticParams().forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                throw new BadRequestException("Missing value for " + key);
            }
        });
    }

    /**
     * Copy the setup headers into container system metadata. Driver keys of
     * every registered provider are mirrored, the rest of the
     * X-Container-Migration-* space stays user metadata.
     */
    private void mirrorSetupHeaders(HttpHeaders headers) {
        List<String> mirrored = new ArrayList<>(List.of(
                ProxyHeaders.X_CONTAINER_MIGRATION_PROVIDER,
                ProxyHeaders.X_CONTAINER_MIGRATION_SOURCE,
                ProxyHeaders.X_CONTAINER_MIGRATION_ACTIVE));
        registry.find(headers.getFirst(ProxyHeaders.X_CONTAINER_MIGRATION_PROVIDER))
                .ifPresent(registration -> registration.getRequiredKeys()
                        .forEach(key -> mirrored.add(keyHeader(key))));

        for (String name : mirrored) {
            List<String> values = headers.get(name);
            if (values != null) {
                String sysmeta = ProxyHeaders.X_CONTAINER_SYSMETA_MIGRATION_PREFIX
                        + name.substring(ProxyHeaders.X_CONTAINER_MIGRATION_PREFIX.length());
                headers.put(sysmeta, new ArrayList<>(values));
            }
        }
    }

    private ProxyResponse reflectMigrationHeaders(ProxyResponse response) {
        HttpHeaders headers = response.getHeaders();
        for (String suffix : REFLECTED) {
            String value = headers.getFirst(ProxyHeaders.X_CONTAINER_SYSMETA_MIGRATION_PREFIX + suffix);
            if (value != null) {
                headers.set(ProxyHeaders.X_CONTAINER_MIGRATION_PREFIX + suffix, value);
            }
        }
        return response;
    }

    /**
     * "token-url" -> "X-Container-Migration-Token-Url"
     */
    static String keyHeader(String key) {
        StringBuilder sb = new StringBuilder(ProxyHeaders.X_CONTAINER_MIGRATION_PREFIX);
        boolean upper = true;
        for (char c : key.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = !Character.isLetter(c);
        }
        return sb.toString();
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
