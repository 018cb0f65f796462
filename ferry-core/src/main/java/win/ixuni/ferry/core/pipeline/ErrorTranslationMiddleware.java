package win.ixuni.ferry.core.pipeline;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.exception.FerryException;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;

/**
 * Global error translation
 * <p>
 * Converts {@link FerryException}s into plain-text responses carrying their
 * status; any other failure becomes a 500.
 */
@Slf4j
public class ErrorTranslationMiddleware implements ProxyMiddleware {

    @Override
    public Mono<ProxyResponse> intercept(ProxyRequest request, ProxyHandler next) {
        return Mono.defer(() -> next.handle(request))
                .onErrorResume(FerryException.class, ex -> {
                    log.warn("Request error: {} {} -> {} {}",
                            request.getMethod(), request.getPath(), ex.getHttpStatus(), ex.getMessage());
                    return Mono.just(ProxyResponse.text(ex.getHttpStatus(), ex.getMessage()));
                })
                .onErrorResume(ex -> !(ex instanceof FerryException), ex -> {
                    log.error("Internal error: {} {}: {}", request.getMethod(), request.getPath(), ex.getMessage(), ex);
                    return Mono.just(ProxyResponse.text(500, "An internal error occurred"));
                });
    }

    @Override
    public int getOrder() {
        return -300; // 最外层
    }
}
