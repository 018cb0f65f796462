package win.ixuni.ferry.core.pipeline;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;

/**
 * 请求日志中间件
 * <p>
 * Logs one line per client request with status, duration and whatever the
 * inner middlewares added to the context's log info.
 */
@Slf4j
public class RequestLoggingMiddleware implements ProxyMiddleware {

    @Override
    public Mono<ProxyResponse> intercept(ProxyRequest request, ProxyHandler next) {
        final long startTime = System.currentTimeMillis();
        final String method = request.getMethod();
        final String path = request.getPath();

        log.debug("Starting request: {} {}", method, path);

        return next.handle(request)
                .doOnSuccess(response -> {
                    long duration = System.currentTimeMillis() - startTime;
                    String logInfo = request.getContext().getLogInfo().isEmpty()
                            ? "-"
                            : String.join(",", request.getContext().getLogInfo());
                    log.info("{} {} -> {} in {}ms ({})",
                            originalMethod(request, method), path,
                            response != null ? response.getStatus() : "-", duration, logInfo);
                })
                .doOnError(error -> {
                    long duration = System.currentTimeMillis() - startTime;
                    log.warn("{} {} failed after {}ms: {}", method, path, duration, error.getMessage());
                });
    }

    private String originalMethod(ProxyRequest request, String method) {
        String original = request.getContext().getOriginalMethod();
        return original != null ? original : method;
    }

    @Override
    public int getOrder() {
        return -200;
    }
}
