package win.ixuni.ferry.core.support;

import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.pipeline.ProxyHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录所有经过的请求，再交给被包装的处理器
 */
public class RecordingHandler implements ProxyHandler {

    private final ProxyHandler delegate;
    private final List<ProxyRequest> requests = new CopyOnWriteArrayList<>();

    public RecordingHandler(ProxyHandler delegate) {
        this.delegate = delegate;
    }

    @Override
    public Mono<ProxyResponse> handle(ProxyRequest request) {
        requests.add(request);
        return delegate.handle(request);
    }

    public List<ProxyRequest> getRequests() {
        return requests;
    }

    public long count(String method) {
        return requests.stream().filter(r -> method.equals(r.getMethod())).count();
    }

    public void clear() {
        requests.clear();
    }
}
