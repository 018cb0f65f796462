package win.ixuni.ferry.server.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.util.BodyUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 转发后端
 * <p>
 * Sends requests to the storage backend over HTTP. Response bodies are
 * streamed through unread; every status, errors included, is returned as a
 * response rather than an exception.
 */
@Slf4j
public class ForwardingBackend implements ProxyHandler {

    /**
     * Hop-by-hop headers, never forwarded
     */
    private static final List<String> HOP_BY_HOP = List.of(
            HttpHeaders.CONNECTION, HttpHeaders.TRANSFER_ENCODING, "Keep-Alive",
            HttpHeaders.UPGRADE, HttpHeaders.TE, HttpHeaders.TRAILER, HttpHeaders.HOST);

    private final WebClient webClient;
    private final String baseUrl;

    public ForwardingBackend(WebClient.Builder builder, String baseUrl) {
        this.webClient = builder.build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Mono<ProxyResponse> handle(ProxyRequest request) {
        URI uri = buildUri(request);

        HttpHeaders headers = new HttpHeaders();
        headers.addAll(request.getHeaders());
        HOP_BY_HOP.forEach(headers::remove);

        log.debug("Forwarding {} {}", request.getMethod(), uri);
        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.getMethod()))
                .uri(uri)
                .headers(h -> h.addAll(headers));
        if (request.getContentLength() > 0 || request.isChunked()) {
            Flux<DataBuffer> body = request.getBody().map(DefaultDataBufferFactory.sharedInstance::wrap);
            spec.body(BodyInserters.fromDataBuffers(body));
        }
        return spec.retrieve()
                // 后端的 4xx/5xx 原样交给中间件处理
                .onStatus(status -> true, response -> Mono.empty())
                .toEntityFlux(DataBuffer.class)
                .map(entity -> {
                    HttpHeaders responseHeaders = new HttpHeaders();
                    responseHeaders.addAll(entity.getHeaders());
                    HOP_BY_HOP.forEach(responseHeaders::remove);
                    Flux<DataBuffer> body = entity.getBody() != null ? entity.getBody() : Flux.empty();
                    return ProxyResponse.builder()
                            .status(entity.getStatusCode().value())
                            .headers(responseHeaders)
                            .body(BodyUtils.fromDataBuffers(body))
                            .build();
                });
    }

    private URI buildUri(ProxyRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(
                baseUrl + UriUtils.encodePath(request.getPath(), StandardCharsets.UTF_8));
        request.getQueryParams().forEach((name, values) -> {
            String encodedName = UriUtils.encodeQueryParam(name, StandardCharsets.UTF_8);
            for (String value : values) {
                if (value == null) {
                    builder.queryParam(encodedName);
                } else {
                    builder.queryParam(encodedName, UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8));
                }
            }
        });
        return builder.build(true).toUri();
    }
}
