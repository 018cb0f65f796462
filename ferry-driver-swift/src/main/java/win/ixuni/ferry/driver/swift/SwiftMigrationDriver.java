package win.ixuni.ferry.driver.swift;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.exception.MigrationDriverException;
import win.ixuni.ferry.core.http.MetadataHeaders;
import win.ixuni.ferry.core.http.ProxyHeaders;
import win.ixuni.ferry.core.migration.driver.MigratedObject;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;
import win.ixuni.ferry.core.util.BodyUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Swift 迁移驱动
 * <p>
 * Migrates objects from a container of another Swift cluster using
 * v1 (TempAuth style) authentication. Required container metadata:
 * <pre>
 * X-Container-Migration-Token-Url: http://127.0.0.1:8080/auth/v1.0
 * X-Container-Migration-User: test:tester
 * X-Container-Migration-Key: testing
 * X-Container-Migration-Source: container holding the objects
 * </pre>
 */
@Slf4j
public class SwiftMigrationDriver implements MigrationDriver {

    public static final String TOKEN_URL = "token-url";
    public static final String USER = "user";
    public static final String KEY = "key";

    static final String X_AUTH_USER = "X-Auth-User";
    static final String X_AUTH_KEY = "X-Auth-Key";
    static final String X_AUTH_TOKEN = "X-Auth-Token";
    static final String X_STORAGE_URL = "X-Storage-Url";

    private final WebClient webClient;
    private final String container;
    private final String tokenUrl;
    private final String user;
    private final String key;

    public SwiftMigrationDriver(WebClient webClient, String container, MigrationParameters params) {
        this.webClient = webClient;
        this.container = container;
        this.tokenUrl = params.require(TOKEN_URL);
        this.user = params.get(USER, "");
        this.key = params.get(KEY, "");
    }

    @Override
    public Mono<MigratedObject> fetch(String objectName) {
        return authenticate()
                .flatMap(auth -> getObject(auth, objectName));
    }

    private Mono<Auth> authenticate() {
        return webClient.get()
                .uri(URI.create(tokenUrl))
                .header(X_AUTH_USER, user)
                .header(X_AUTH_KEY, key)
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return failure(response, "Authentication failed: ").flatMap(Mono::<Auth>error);
                    }
                    HttpHeaders headers = response.headers().asHttpHeaders();
                    String storageUrl = headers.getFirst(X_STORAGE_URL);
                    String token = headers.getFirst(X_AUTH_TOKEN);
                    return response.releaseBody().then(Mono.defer(() -> {
                        if (storageUrl == null || token == null) {
                            return Mono.error(new MigrationDriverException(
                                    "Authentication failed: no storage URL or token returned"));
                        }
                        return Mono.just(new Auth(storageUrl, token));
                    }));
                })
                .onErrorMap(WebClientRequestException.class,
                        e -> new MigrationDriverException("Connection failed to " + tokenUrl, e));
    }

    private Mono<MigratedObject> getObject(Auth auth, String objectName) {
        String url = stripTrailingSlash(auth.storageUrl())
                + "/" + UriUtils.encodePathSegment(container, StandardCharsets.UTF_8)
                + "/" + UriUtils.encodePath(objectName, StandardCharsets.UTF_8);

        return webClient.get()
                .uri(URI.create(url))
                .header(X_AUTH_TOKEN, auth.token())
                // keeps a migrating remote from migrating in turn
                .header(ProxyHeaders.X_CONTAINER_MIGRATION_PROVIDER, SwiftMigrationDriverFactory.DRIVER_TYPE)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response -> failure(response, "Object GET failed: "))
                .toEntityFlux(DataBuffer.class)
                .map(entity -> toMigratedObject(entity.getHeaders(),
                        entity.getBody() != null ? entity.getBody() : Flux.empty()))
                .onErrorMap(WebClientRequestException.class,
                        e -> new MigrationDriverException("Connection failed to " + auth.storageUrl(), e));
    }

    /**
     * The body is streamed; size is the remote Content-Length, -1 when absent
     */
    private MigratedObject toMigratedObject(HttpHeaders headers, Flux<DataBuffer> body) {
        Map<String, String> metadata = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (MetadataHeaders.isUserMeta(MetadataHeaders.OBJECT, name) && !values.isEmpty()) {
                metadata.put(name.toLowerCase(Locale.ROOT), values.get(0));
            }
        });
        return MigratedObject.builder()
                .metadata(metadata)
                .size(headers.getContentLength())
                .content(BodyUtils.fromDataBuffers(body))
                .contentType(headers.getFirst(HttpHeaders.CONTENT_TYPE))
                .timestamp(ProxyHeaders.parseTimestamp(headers.getFirst(ProxyHeaders.X_TIMESTAMP)))
                .build();
    }

    private static Mono<MigrationDriverException> failure(ClientResponse response, String prefix) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new MigrationDriverException(
                        prefix + (body.isEmpty() ? String.valueOf(response.statusCode().value()) : body)));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record Auth(String storageUrl, String token) {
    }
}
