package win.ixuni.ferry.core.http;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Inbound request as seen by the middleware pipeline
 * <p>
 * Middlewares may rewrite method, path and headers in place; anything they
 * send downstream on their own behalf goes through {@link #subRequest}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyRequest {

    private String method;

    /**
     * Decoded path, e.g. /v1/AUTH_test/photos/2024/cat.jpg
     */
    private String path;

    @Builder.Default
    private HttpHeaders headers = new HttpHeaders();

    @Builder.Default
    private MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();

    @Builder.Default
    private Flux<ByteBuffer> body = Flux.empty();

    @Builder.Default
    private RequestContext context = new RequestContext();

    public Optional<RequestPath> getRequestPath() {
        return RequestPath.parse(path);
    }

    /**
     * @return declared body length, -1 when absent
     */
    public long getContentLength() {
        return headers.getContentLength();
    }

    public boolean isChunked() {
        String te = headers.getFirst(HttpHeaders.TRANSFER_ENCODING);
        return te != null && te.toLowerCase().contains("chunked");
    }

    public String getQueryParam(String name) {
        return queryParams.getFirst(name);
    }

    /**
     * Build an internal request issued on behalf of this one
     *
     * @param method  method of the sub-request
     * @param path    decoded path of the sub-request
     * @param headers headers to send (copied)
     * @param source  tag of the issuing middleware
     */
    public ProxyRequest subRequest(String method, String path, HttpHeaders headers, String source) {
        RequestContext subContext = context.copy();
        subContext.setSource(source);
        HttpHeaders subHeaders = new HttpHeaders();
        if (headers != null) {
            subHeaders.addAll(headers);
        }
        return ProxyRequest.builder()
                .method(method)
                .path(path)
                .headers(subHeaders)
                .queryParams(new LinkedMultiValueMap<>(queryParams))
                .context(subContext)
                .build();
    }

    /**
     * Snapshot of method, path, headers and query taken before anything rewrites them
     */
    public ProxyRequest copy() {
        HttpHeaders headersCopy = new HttpHeaders();
        headersCopy.addAll(headers);
        return ProxyRequest.builder()
                .method(method)
                .path(path)
                .headers(headersCopy)
                .queryParams(new LinkedMultiValueMap<>(queryParams))
                .body(body)
                .context(context)
                .build();
    }
}
