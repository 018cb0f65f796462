package win.ixuni.ferry.core.backend;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.MetadataHeaders;
import win.ixuni.ferry.core.http.ProxyHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.http.RequestPath;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.util.BodyUtils;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 内存后端
 * <p>
 * A small in-process object store speaking the same protocol as the real
 * backend: accounts, containers and objects with user and system metadata.
 * Meant for development and tests; nothing survives a restart.
 */
@Slf4j
public class MemoryBackend implements ProxyHandler {

    public static final String ALLOWED_METHODS = "GET, HEAD, PUT, POST, DELETE, OPTIONS";

    private static final String X_CONTAINER_OBJECT_COUNT = "X-Container-Object-Count";

    /**
     * Container storage: account/container -> ContainerInfo
     */
    private final Map<String, ContainerInfo> containers = new ConcurrentHashMap<>();

    /**
     * Object storage: account/container/object -> ObjectData
     */
    private final Map<String, ObjectData> objects = new ConcurrentHashMap<>();

    @Override
    public Mono<ProxyResponse> handle(ProxyRequest request) {
        RequestPath path = request.getRequestPath().orElse(null);
        if (path == null) {
            return Mono.just(ProxyResponse.text(400, "Invalid path: " + request.getPath()));
        }
        if ("OPTIONS".equals(request.getMethod())) {
            return Mono.just(options());
        }
        if (path.isObject()) {
            return handleObject(path, request);
        }
        if (path.isContainer()) {
            return Mono.fromCallable(() -> handleContainer(path, request));
        }
        return Mono.fromCallable(() -> handleAccount(path, request));
    }

    // ============ Account ============

    private ProxyResponse handleAccount(RequestPath path, ProxyRequest request) {
        String prefix = path.getAccount() + "/";
        List<String> names = containers.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .map(key -> key.substring(prefix.length()))
                .sorted()
                .toList();
        return switch (request.getMethod()) {
            case "GET" -> listing(names);
            case "HEAD" -> ProxyResponse.of(204);
            default -> ProxyResponse.text(405, "Method Not Allowed");
        };
    }

    // ============ Container ============

    private ProxyResponse handleContainer(RequestPath path, ProxyRequest request) {
        String key = containerKey(path);
        ContainerInfo container = containers.get(key);
        switch (request.getMethod()) {
            case "PUT": {
                if (container == null) {
                    container = ContainerInfo.builder().name(path.getContainer()).created(Instant.now()).build();
                    containers.put(key, container);
                    updateMetadata(container.getMetadata(), request.getHeaders(),
                            h -> MetadataHeaders.isSysOrUserMeta(MetadataHeaders.CONTAINER, h));
                    log.debug("Created container {}", key);
                    return ProxyResponse.of(201);
                }
                updateMetadata(container.getMetadata(), request.getHeaders(),
                        h -> MetadataHeaders.isSysOrUserMeta(MetadataHeaders.CONTAINER, h));
                return ProxyResponse.of(202);
            }
            case "POST": {
                if (container == null) {
                    return notFound();
                }
                updateMetadata(container.getMetadata(), request.getHeaders(),
                        h -> MetadataHeaders.isSysOrUserMeta(MetadataHeaders.CONTAINER, h));
                return ProxyResponse.of(204);
            }
            case "HEAD":
            case "GET": {
                if (container == null) {
                    return notFound();
                }
                List<String> names = objectNames(key);
                ProxyResponse response = "GET".equals(request.getMethod()) && !names.isEmpty()
                        ? listing(names)
                        : ProxyResponse.of(204);
                container.getMetadata().forEach(response.getHeaders()::set);
                response.getHeaders().set(X_CONTAINER_OBJECT_COUNT, String.valueOf(names.size()));
                return response;
            }
            case "DELETE": {
                if (container == null) {
                    return notFound();
                }
                if (!objectNames(key).isEmpty()) {
                    return ProxyResponse.text(409, "There was a conflict when trying to complete your request.");
                }
                containers.remove(key);
                return ProxyResponse.of(204);
            }
            default:
                return ProxyResponse.text(405, "Method Not Allowed");
        }
    }

    // ============ Object ============

    private Mono<ProxyResponse> handleObject(RequestPath path, ProxyRequest request) {
        String key = objectKey(path);
        switch (request.getMethod()) {
            case "PUT":
                return putObject(path, request);
            case "GET":
            case "HEAD":
                return Mono.fromCallable(() -> getObject(key, "GET".equals(request.getMethod())));
            case "POST":
                return Mono.fromCallable(() -> postObject(key, request.getHeaders()));
            case "DELETE":
                return Mono.fromCallable(() -> objects.remove(key) == null ? notFound() : ProxyResponse.of(204));
            default:
                return Mono.just(ProxyResponse.text(405, "Method Not Allowed"));
        }
    }

    private Mono<ProxyResponse> putObject(RequestPath path, ProxyRequest request) {
        if (!containers.containsKey(containerKey(path))) {
            return Mono.just(notFound());
        }
        HttpHeaders headers = request.getHeaders();
        return BodyUtils.join(request.getBody()).map(data -> {
            String etag = md5Hex(data);
            String expected = headers.getFirst(ProxyHeaders.ETAG);
            if (StringUtils.hasText(expected) && !etag.equalsIgnoreCase(unquote(expected))) {
                return ProxyResponse.text(422, "Unprocessable Entity");
            }

            Instant timestamp = ProxyHeaders.parseTimestamp(headers.getFirst(ProxyHeaders.X_TIMESTAMP));
            if (timestamp == null) {
                timestamp = Instant.now();
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            updateMetadata(metadata, headers, MemoryBackend::isStoredObjectHeader);

            String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
            ObjectData object = ObjectData.builder()
                    .data(data)
                    .etag(etag)
                    .contentType(StringUtils.hasText(contentType) ? contentType : MediaType.APPLICATION_OCTET_STREAM_VALUE)
                    .timestamp(timestamp)
                    .metadata(new ConcurrentHashMap<>(metadata))
                    .build();
            objects.put(objectKey(path), object);
            log.debug("Stored object {} ({} bytes)", path, data.length);

            ProxyResponse response = ProxyResponse.of(201);
            response.getHeaders().set(ProxyHeaders.ETAG, etag);
            response.getHeaders().set(HttpHeaders.LAST_MODIFIED, httpDate(timestamp));
            return response;
        });
    }

    private ProxyResponse getObject(String key, boolean withBody) {
        ObjectData object = objects.get(key);
        if (object == null) {
            return notFound();
        }
        HttpHeaders headers = new HttpHeaders();
        object.getMetadata().forEach(headers::set);
        headers.set(HttpHeaders.CONTENT_TYPE, object.getContentType());
        headers.setContentLength(object.getData().length);
        headers.set(ProxyHeaders.ETAG, object.getEtag());
        headers.set(HttpHeaders.LAST_MODIFIED, httpDate(object.getTimestamp()));
        headers.set(ProxyHeaders.X_TIMESTAMP, ProxyHeaders.formatTimestamp(object.getTimestamp()));
        return ProxyResponse.builder()
                .status(200)
                .headers(headers)
                .body(withBody ? BodyUtils.of(object.getData()) : BodyUtils.of(new byte[0]))
                .build();
    }

    private ProxyResponse postObject(String key, HttpHeaders headers) {
        ObjectData object = objects.get(key);
        if (object == null) {
            return notFound();
        }
        // POST replaces the user metadata as a whole
        object.getMetadata().keySet().removeIf(h -> MetadataHeaders.isUserMeta(MetadataHeaders.OBJECT, h)
                || ProxyHeaders.X_DELETE_AT.equalsIgnoreCase(h));
        updateMetadata(object.getMetadata(), headers, MetadataHeaders::isCopiedObjectHeader);
        String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        ObjectData updated = StringUtils.hasText(contentType) ? object.withContentType(contentType) : object;
        objects.put(key, updated);
        return ProxyResponse.of(202);
    }

    private ProxyResponse options() {
        ProxyResponse response = ProxyResponse.of(200);
        response.getHeaders().set(HttpHeaders.ALLOW, ALLOWED_METHODS);
        response.getHeaders().set(ProxyHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
        return response;
    }

    // ============ Utility Methods ============

    /**
     * Set headers matching {@code condition}; an empty value deletes the key
     */
    private static void updateMetadata(Map<String, String> metadata, HttpHeaders headers, Predicate<String> condition) {
        headers.forEach((name, values) -> {
            if (!condition.test(name)) {
                return;
            }
            String normalized = canonical(name);
            String value = values.isEmpty() ? "" : values.get(0);
            if (value.isEmpty()) {
                metadata.remove(normalized);
            } else {
                metadata.put(normalized, value);
            }
        });
    }

    private static boolean isStoredObjectHeader(String name) {
        return MetadataHeaders.isCopiedObjectHeader(name)
                || ProxyHeaders.X_STATIC_LARGE_OBJECT.equalsIgnoreCase(name);
    }

    /**
     * "x-object-meta-color" -> "X-Object-Meta-Color"
     */
    private static String canonical(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = true;
        for (char c : name.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = c == '-';
        }
        return sb.toString();
    }

    private List<String> objectNames(String containerKey) {
        String prefix = containerKey + "/";
        return objects.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .map(key -> key.substring(prefix.length()))
                .sorted()
                .toList();
    }

    private static ProxyResponse listing(List<String> names) {
        List<String> lines = new ArrayList<>(names);
        String body = lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
        return ProxyResponse.text(200, body);
    }

    private static ProxyResponse notFound() {
        return ProxyResponse.text(404, "Not Found");
    }

    private static String containerKey(RequestPath path) {
        return path.getAccount() + "/" + path.getContainer();
    }

    private static String objectKey(RequestPath path) {
        return containerKey(path) + "/" + path.getObject();
    }

    private static String unquote(String etag) {
        String value = etag.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String httpDate(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atZone(ZoneOffset.UTC));
    }

    private static String md5Hex(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(data);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    // ============ Data Structure Definitions ============

    @Getter
    @Builder
    public static class ContainerInfo {
        private final String name;
        private final Instant created;
        @Builder.Default
        private final Map<String, String> metadata = new ConcurrentHashMap<>();
    }

    @Getter
    @Builder(toBuilder = true)
    public static class ObjectData {
        private final byte[] data;
        private final String etag;
        private final String contentType;
        private final Instant timestamp;
        private final Map<String, String> metadata;

        ObjectData withContentType(String contentType) {
            return toBuilder().contentType(contentType).build();
        }
    }
}
