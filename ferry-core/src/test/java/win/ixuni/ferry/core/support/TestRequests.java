package win.ixuni.ferry.core.support;

import org.springframework.http.HttpHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.util.BodyUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * 测试请求构造工具
 */
public final class TestRequests {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private TestRequests() {
    }

    public static ProxyRequest request(String method, String path) {
        return request(method, path, Map.of());
    }

    public static ProxyRequest request(String method, String path, Map<String, String> headers) {
        HttpHeaders httpHeaders = new HttpHeaders();
        headers.forEach(httpHeaders::set);
        return ProxyRequest.builder()
                .method(method)
                .path(path)
                .headers(httpHeaders)
                .build();
    }

    public static ProxyRequest put(String path, String body, Map<String, String> headers) {
        ProxyRequest request = request("PUT", path, headers);
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        request.getHeaders().setContentLength(bytes.length);
        request.setBody(BodyUtils.of(bytes));
        return request;
    }

    public static ProxyResponse call(ProxyHandler handler, ProxyRequest request) {
        return handler.handle(request).block(TIMEOUT);
    }

    public static String body(ProxyResponse response) {
        return BodyUtils.joinAsString(response.getBody()).block(TIMEOUT);
    }
}
