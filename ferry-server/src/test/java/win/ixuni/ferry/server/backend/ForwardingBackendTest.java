package win.ixuni.ferry.server.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.util.BodyUtils;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 转发后端测试：使用桩 ExchangeFunction，不访问网络
 */
class ForwardingBackendTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private ForwardingBackend backend(ClientResponse response) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(response);
        });
        return new ForwardingBackend(builder, "http://storage.local:8080/");
    }

    private static Flux<DataBuffer> chunks(String... parts) {
        return Flux.fromArray(parts)
                .map(part -> DefaultDataBufferFactory.sharedInstance.wrap(part.getBytes(StandardCharsets.UTF_8)));
    }

    private static ProxyRequest get(String path) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Auth-Token", "tk");
        headers.set(HttpHeaders.CONNECTION, "keep-alive");
        LinkedMultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("multipart-manifest", "get");
        return ProxyRequest.builder()
                .method("GET")
                .path(path)
                .headers(headers)
                .queryParams(query)
                .build();
    }

    @Test
    @DisplayName("响应体按流转发，读取前不订阅")
    void testHandle_StreamsBody() {
        AtomicBoolean subscribed = new AtomicBoolean();
        ClientResponse upstream = ClientResponse.create(HttpStatus.OK)
                .header("ETag", "abc")
                .header(HttpHeaders.TRANSFER_ENCODING, "chunked")
                .body(chunks("hello ", "stream").doOnSubscribe(s -> subscribed.set(true)))
                .build();

        ProxyResponse response = backend(upstream).handle(get("/v1/AUTH_test/photos/a b.txt")).block();

        assertNotNull(response);
        assertEquals(200, response.getStatus());
        assertEquals("abc", response.getHeader("ETag"));
        assertNull(response.getHeader(HttpHeaders.TRANSFER_ENCODING));
        assertFalse(subscribed.get());

        assertEquals("hello stream", BodyUtils.joinAsString(response.getBody()).block());
        assertTrue(subscribed.get());
    }

    @Test
    @DisplayName("请求地址编码，逐跳头不转发")
    void testHandle_RequestShape() {
        backend(ClientResponse.create(HttpStatus.OK).build())
                .handle(get("/v1/AUTH_test/photos/a b.txt")).block();

        ClientRequest sent = lastRequest.get();
        assertEquals("GET", sent.method().name());
        assertEquals("/v1/AUTH_test/photos/a%20b.txt", sent.url().getRawPath());
        assertEquals("multipart-manifest=get", sent.url().getRawQuery());
        assertEquals("tk", sent.headers().getFirst("X-Auth-Token"));
        assertNull(sent.headers().getFirst(HttpHeaders.CONNECTION));
    }

    @Test
    @DisplayName("后端错误状态作为响应返回而非异常")
    void testHandle_ErrorStatusPassesThrough() {
        ClientResponse upstream = ClientResponse.create(HttpStatus.NOT_FOUND)
                .header(HttpHeaders.CONTENT_TYPE, "text/plain")
                .body("Not Found")
                .build();

        ProxyResponse response = backend(upstream).handle(get("/v1/AUTH_test/photos/missing")).block();

        assertNotNull(response);
        assertEquals(404, response.getStatus());
        assertEquals("Not Found", BodyUtils.joinAsString(response.getBody()).block());
    }

    @Test
    @DisplayName("丢弃响应体时取消上游读取")
    void testDiscardBody_CancelsUpstream() {
        AtomicBoolean cancelled = new AtomicBoolean();
        ClientResponse upstream = ClientResponse.create(HttpStatus.NOT_FOUND)
                .body(chunks("large", "body").doOnCancel(() -> cancelled.set(true)))
                .build();

        ProxyResponse response = backend(upstream).handle(get("/v1/AUTH_test/photos/gone")).block();
        assertNotNull(response);
        response.discardBody();

        assertTrue(cancelled.get());
        assertEquals("", BodyUtils.joinAsString(response.getBody()).block());
    }
}
