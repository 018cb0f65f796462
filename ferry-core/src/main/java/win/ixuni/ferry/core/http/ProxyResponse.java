package win.ixuni.ferry.core.http;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import reactor.core.publisher.Flux;
import win.ixuni.ferry.core.util.BodyUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Response produced by the backend or by a middleware
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyResponse {

    private int status;

    @Builder.Default
    private HttpHeaders headers = new HttpHeaders();

    @Builder.Default
    private Flux<ByteBuffer> body = Flux.empty();

    public static ProxyResponse of(int status) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentLength(0);
        return ProxyResponse.builder().status(status).headers(headers).build();
    }

    /**
     * Plain-text response, the way the backend reports errors
     */
    public static ProxyResponse text(int status, String message) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        headers.setContentLength(bytes.length);
        return ProxyResponse.builder()
                .status(status)
                .headers(headers)
                .body(BodyUtils.of(bytes))
                .build();
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * @return Content-Length, -1 when the length is indeterminate
     */
    public long getContentLength() {
        return headers.getContentLength();
    }

    public String getHeader(String name) {
        return headers.getFirst(name);
    }

    /**
     * 丢弃不会再转发的响应体
     * <p>
     * A streamed body holds its backend connection until it is read or
     * cancelled; this cancels it.
     */
    public void discardBody() {
        Flux<ByteBuffer> dropped = body;
        body = Flux.empty();
        BodyUtils.discard(dropped);
    }
}
