package win.ixuni.ferry.server.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.config.FerryProperties;
import win.ixuni.ferry.core.exception.EntityTooLargeException;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.migration.driver.MigrationDriverRegistry;
import win.ixuni.ferry.core.pipeline.MiddlewarePipeline;
import win.ixuni.ferry.core.util.BodyUtils;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 集群信息（GET /info）
 * <p>
 * Passes the request to the backend and adds a {@code data_migration}
 * section naming every provider whose driver is loaded. When the backend
 * has no JSON info of its own, only the proxy's section is returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterInfoHandler {

    public static final String INFO_PATH = "/info";
    public static final String MIGRATION_SECTION = "data_migration";

    private static final long MAX_INFO_BYTES = 1024 * 1024;
    private static final TypeReference<LinkedHashMap<String, Object>> INFO_TYPE = new TypeReference<>() {
    };

    private final MiddlewarePipeline pipeline;
    private final MigrationDriverRegistry registry;
    private final FerryProperties properties;
    private final ObjectMapper objectMapper;

    public Mono<ServerResponse> handle(ServerRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(request.headers().asHttpHeaders());
        headers.remove(HttpHeaders.HOST);

        ProxyRequest infoRequest = ProxyRequest.builder()
                .method("GET")
                .path(INFO_PATH)
                .headers(headers)
                .queryParams(new LinkedMultiValueMap<>(request.queryParams()))
                .build();

        return clusterInfo(infoRequest)
                .flatMap(info -> ServerResponse.ok()
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(info));
    }

    Mono<Map<String, Object>> clusterInfo(ProxyRequest infoRequest) {
        return pipeline.handle(infoRequest)
                .flatMap(this::backendInfo)
                .map(info -> {
                    if (properties.getMigration().isEnabled()) {
                        Map<String, String> section = new LinkedHashMap<>();
                        registry.getEnabledProviders().forEach(provider -> section.put(provider, "enabled"));
                        info.put(MIGRATION_SECTION, section);
                    }
                    return info;
                });
    }

    private Mono<Map<String, Object>> backendInfo(ProxyResponse response) {
        MediaType type = response.getHeaders().getContentType();
        if (!response.isSuccess() || type == null || !MediaType.APPLICATION_JSON.isCompatibleWith(type)) {
            log.debug("Backend answered {} {} without JSON info", INFO_PATH, response.getStatus());
            response.discardBody();
            return Mono.just(new LinkedHashMap<>());
        }
        return BodyUtils.join(response.getBody(), MAX_INFO_BYTES,
                        () -> new EntityTooLargeException("Cluster info exceeds " + MAX_INFO_BYTES + " bytes"))
                .map(this::readInfo);
    }

    private Map<String, Object> readInfo(byte[] json) {
        try {
            return objectMapper.readValue(json, INFO_TYPE);
        } catch (IOException e) {
            log.warn("Ignoring unreadable backend cluster info: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
