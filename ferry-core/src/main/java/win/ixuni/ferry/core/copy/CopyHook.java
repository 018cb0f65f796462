package win.ixuni.ferry.core.copy;

import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;

/**
 * Gives upper middlewares a way to change the copy source
 * <p>
 * For example, copying a large-object manifest can yield the concatenated
 * segments (what a GET returns to the client) instead of the manifest itself.
 */
@FunctionalInterface
public interface CopyHook {

    /**
     * @param sourceRequest   the GET issued for the copy source
     * @param sourceResponse  what the backend answered
     * @param originalRequest the (rewritten) copy request
     * @return the response to use as copy source
     */
    Mono<ProxyResponse> apply(ProxyRequest sourceRequest, ProxyResponse sourceResponse, ProxyRequest originalRequest);
}
