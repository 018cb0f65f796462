package win.ixuni.ferry.server.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.pipeline.MiddlewarePipeline;
import win.ixuni.ferry.core.util.BodyUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Entry point for every client request
 * <p>
 * Converts the exchange into a {@link ProxyRequest}, runs the pipeline and
 * writes the {@link ProxyResponse} back. Any method is accepted, COPY included.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProxyGatewayHandler {

    private final MiddlewarePipeline pipeline;

    public Mono<ServerResponse> handle(ServerRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(request.headers().asHttpHeaders());
        headers.remove(HttpHeaders.HOST);

        // 普通请求体，直接转换 DataBuffer 为 ByteBuffer
        Flux<ByteBuffer> body = BodyUtils.fromDataBuffers(request.bodyToFlux(DataBuffer.class));

        ProxyRequest proxyRequest = ProxyRequest.builder()
                .method(request.method().name())
                .path(UriUtils.decode(request.uri().getRawPath(), StandardCharsets.UTF_8))
                .headers(headers)
                .queryParams(new LinkedMultiValueMap<>(request.queryParams()))
                .body(body)
                .build();

        return pipeline.handle(proxyRequest).flatMap(this::toServerResponse);
    }

    private Mono<ServerResponse> toServerResponse(ProxyResponse response) {
        Flux<DataBuffer> body = response.getBody()
                .map(DefaultDataBufferFactory.sharedInstance::wrap);
        return ServerResponse.status(response.getStatus())
                .headers(h -> h.addAll(response.getHeaders()))
                .body(BodyInserters.fromDataBuffers(body));
    }
}
