package win.ixuni.ferry.core.pipeline;

import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;

/**
 * Anything that can answer a {@link ProxyRequest}: the storage backend, or
 * the remainder of the middleware pipeline.
 */
@FunctionalInterface
public interface ProxyHandler {

    Mono<ProxyResponse> handle(ProxyRequest request);
}
