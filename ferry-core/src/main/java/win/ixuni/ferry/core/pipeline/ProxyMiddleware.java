package win.ixuni.ferry.core.pipeline;

import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;

/**
 * 代理中间件接口
 * <p>
 * Sees every request before the backend does. Implementations either pass the
 * request on through {@code next}, answer it themselves, or issue their own
 * sub-requests against {@code next}.
 */
public interface ProxyMiddleware {

    /**
     * @param request the request, possibly already rewritten by earlier middlewares
     * @param next    the rest of the pipeline
     * @return the response handed back to the previous middleware
     */
    Mono<ProxyResponse> intercept(ProxyRequest request, ProxyHandler next);

    /**
     * Position in the pipeline (lower number = closer to the client)
     */
    default int getOrder() {
        return 0;
    }
}
