package win.ixuni.ferry.core.copy;

import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.pipeline.ProxyHandler;

import java.util.Arrays;
import java.util.List;

/**
 * Adds COPY to the methods advertised by a successful OPTIONS response
 */
public class OptionsAdvertiser {

    private static final String COPY = "COPY";

    public Mono<ProxyResponse> advertise(ProxyRequest request, ProxyHandler next) {
        return next.handle(request).map(response -> {
            if (response.isSuccess()) {
                appendCopy(response.getHeaders(), HttpHeaders.ALLOW);
                appendCopy(response.getHeaders(), ProxyHeaders.ACCESS_CONTROL_ALLOW_METHODS);
            }
            return response;
        });
    }

    private void appendCopy(HttpHeaders headers, String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return;
        }
        String value = String.join(", ", values);
        boolean present = Arrays.stream(value.split(","))
                .map(String::trim)
                .anyMatch(COPY::equalsIgnoreCase);
        if (!present) {
            headers.set(name, value + ", " + COPY);
        }
    }
}
