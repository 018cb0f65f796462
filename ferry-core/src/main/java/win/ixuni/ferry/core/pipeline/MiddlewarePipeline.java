package win.ixuni.ferry.core.pipeline;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Middleware pipeline
 * <p>
 * Orders middlewares by {@link ProxyMiddleware#getOrder()} and chains them in
 * front of the terminal handler. The chain is built once and is immutable.
 */
@Slf4j
public class MiddlewarePipeline implements ProxyHandler {

    private final List<ProxyMiddleware> middlewares;
    private final ProxyHandler chain;

    public MiddlewarePipeline(List<? extends ProxyMiddleware> middlewares, ProxyHandler terminal) {
        List<ProxyMiddleware> sorted = new ArrayList<>(middlewares);
        sorted.sort(Comparator.comparingInt(ProxyMiddleware::getOrder));
        this.middlewares = List.copyOf(sorted);
        this.chain = buildChain(terminal, 0);
        for (ProxyMiddleware middleware : this.middlewares) {
            log.info("Pipeline middleware: {} (order {})",
                    middleware.getClass().getSimpleName(), middleware.getOrder());
        }
    }

    @Override
    public Mono<ProxyResponse> handle(ProxyRequest request) {
        return chain.handle(request);
    }

    /**
     * Recursively builds the chain from the given index, ending at the terminal handler
     */
    private ProxyHandler buildChain(ProxyHandler terminal, int index) {
        if (index >= middlewares.size()) {
            return terminal;
        }
        ProxyMiddleware middleware = middlewares.get(index);
        ProxyHandler next = buildChain(terminal, index + 1);
        return request -> middleware.intercept(request, next);
    }

    public List<ProxyMiddleware> getMiddlewares() {
        return middlewares;
    }
}
