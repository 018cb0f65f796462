package win.ixuni.ferry.core.migration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.MetadataHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.RequestPath;
import win.ixuni.ferry.core.pipeline.ProxyHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the system metadata of the container owning an object
 */
@Slf4j
public class ContainerMetadataLookup {

    static final String SOURCE_TAG = "DM";

    /**
     * Headers of the client request the container HEAD carries along
     */
    private static final List<String> FORWARDED_HEADERS = List.of("X-Auth-Token", HttpHeaders.AUTHORIZATION);

    /**
     * @return sys-meta of the container keyed by lower-cased suffix, e.g.
     *         {@code migration-active}; empty when the container cannot be read
     */
    public Mono<Map<String, String>> lookup(RequestPath objectPath, ProxyRequest request, ProxyHandler next) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : FORWARDED_HEADERS) {
            List<String> values = request.getHeaders().get(name);
            if (values != null) {
                headers.put(name, values);
            }
        }
        ProxyRequest head = request.subRequest("HEAD", objectPath.containerPath(), headers, SOURCE_TAG);
        head.getQueryParams().clear();

        return next.handle(head).map(response -> {
            Map<String, String> sysmeta = new LinkedHashMap<>();
            if (!response.isSuccess()) {
                log.debug("Container HEAD {} answered {}", objectPath.containerPath(), response.getStatus());
                return sysmeta;
            }
            String prefix = MetadataHeaders.sysMetaPrefix(MetadataHeaders.CONTAINER);
            response.getHeaders().forEach((key, values) -> {
                String lower = key.toLowerCase(Locale.ROOT);
                if (lower.startsWith(prefix) && !values.isEmpty()) {
                    sysmeta.put(lower.substring(prefix.length()), values.get(0));
                }
            });
            return sysmeta;
        });
    }
}
