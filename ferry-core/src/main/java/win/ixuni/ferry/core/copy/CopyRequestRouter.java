package win.ixuni.ferry.core.copy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.exception.BadRequestException;
import win.ixuni.ferry.core.exception.PreconditionFailedException;
import win.ixuni.ferry.core.http.ProxyHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.http.RequestContext;
import win.ixuni.ferry.core.http.RequestPath;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.pipeline.ProxyMiddleware;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Server-side copy middleware
 * <p>
 * Turns every flavour of copy into a PUT carrying {@code X-Copy-From}:
 * <ul>
 *   <li>PUT with X-Copy-From: already canonical</li>
 *   <li>COPY with Destination[-Account]: rewritten to a PUT on the destination</li>
 *   <li>POST, when post-as-copy is on: rewritten to a PUT onto itself</li>
 * </ul>
 * OPTIONS responses get COPY added to the advertised methods. Requests
 * without an object segment pass through untouched.
 */
@Slf4j
public class CopyRequestRouter implements ProxyMiddleware {

    static final String ZERO_BODY_MESSAGE = "Copy requests require a zero byte body";

    private final CopyOrchestrator copyOrchestrator;
    private final OptionsAdvertiser optionsAdvertiser;
    private final boolean objectPostAsCopy;

    public CopyRequestRouter(CopyOrchestrator copyOrchestrator, boolean objectPostAsCopy) {
        this(copyOrchestrator, new OptionsAdvertiser(), objectPostAsCopy);
    }

    public CopyRequestRouter(CopyOrchestrator copyOrchestrator, OptionsAdvertiser optionsAdvertiser,
                             boolean objectPostAsCopy) {
        this.copyOrchestrator = copyOrchestrator;
        this.optionsAdvertiser = optionsAdvertiser;
        this.objectPostAsCopy = objectPostAsCopy;
    }

    @Override
    public Mono<ProxyResponse> intercept(ProxyRequest request, ProxyHandler next) {
        // header validation throws; keep it on the error channel
        return Mono.defer(() -> route(request, next));
    }

    private Mono<ProxyResponse> route(ProxyRequest request, ProxyHandler next) {
        Optional<RequestPath> parsed = request.getRequestPath();
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            return next.handle(request);
        }
        RequestPath path = parsed.get();

        // Keep the method the client sent; it is about to be rewritten
        request.getContext().setOriginalMethod(request.getMethod());

        String method = request.getMethod();
        if ("PUT".equals(method) && StringUtils.hasText(request.getHeaders().getFirst(ProxyHeaders.X_COPY_FROM))) {
            return handlePut(request, next);
        } else if ("COPY".equals(method)) {
            return handleCopy(request, path, next);
        } else if ("POST".equals(method) && objectPostAsCopy) {
            return handleObjectPostAsCopy(request, path, next);
        } else if ("OPTIONS".equals(method)) {
            // account, container and /info OPTIONS never get here
            return optionsAdvertiser.advertise(request, next);
        }
        return next.handle(request);
    }

    private Mono<ProxyResponse> handleObjectPostAsCopy(ProxyRequest request, RequestPath path, ProxyHandler next) {
        request.setMethod("PUT");
        request.setPath(path.toPath());
        request.setBody(Flux.empty());
        request.getHeaders().setContentLength(0);
        request.getHeaders().remove(HttpHeaders.TRANSFER_ENCODING);
        request.getHeaders().set(ProxyHeaders.X_COPY_FROM,
                UriUtils.encodePath("/" + path.containerAndObject(), StandardCharsets.UTF_8));
        request.getContext().setPostAsCopy(true);
        return handlePut(request, next);
    }

    private Mono<ProxyResponse> handleCopy(ProxyRequest request, RequestPath path, ProxyHandler next) {
        HttpHeaders headers = request.getHeaders();
        if (hasBody(request)) {
            return Mono.error(new BadRequestException(ZERO_BODY_MESSAGE));
        }
        if (!StringUtils.hasText(headers.getFirst(ProxyHeaders.DESTINATION))) {
            return Mono.error(new PreconditionFailedException("Destination header required"));
        }
        String destAccount = path.getAccount();
        if (headers.containsKey(ProxyHeaders.DESTINATION_ACCOUNT)) {
            destAccount = CopyPaths.checkAccountFormat(headers.getFirst(ProxyHeaders.DESTINATION_ACCOUNT));
            headers.set(ProxyHeaders.X_COPY_FROM_ACCOUNT, path.getAccount());
            headers.remove(ProxyHeaders.DESTINATION_ACCOUNT);
        }
        CopyPaths.Target dest = CopyPaths.checkPathHeader(request, ProxyHeaders.DESTINATION);
        String source = "/" + path.containerAndObject();

        // Rewrite the existing request as a PUT on the destination instead of creating a new one
        request.setMethod("PUT");
        request.setPath(RequestPath.of(path.getVersion(), destAccount, dest.container(), dest.object()).toPath());
        headers.setContentLength(0);
        headers.set(ProxyHeaders.X_COPY_FROM, UriUtils.encodePath(source, StandardCharsets.UTF_8));
        headers.remove(ProxyHeaders.DESTINATION);
        return handlePut(request, next);
    }

    private Mono<ProxyResponse> handlePut(ProxyRequest request, ProxyHandler next) {
        if (hasBody(request)) {
            return Mono.error(new BadRequestException(ZERO_BODY_MESSAGE));
        }

        RequestContext context = request.getContext();
        if (!"POST".equals(context.getOriginalMethod())) {
            context.addLogInfo("x-copy-from:" + request.getHeaders().getFirst(ProxyHeaders.X_COPY_FROM));
        }

        // Form the path of the source object to be fetched
        RequestPath destination = request.getRequestPath()
                .orElseThrow(() -> new BadRequestException("Invalid path: " + request.getPath()));
        String srcAccount = request.getHeaders().getFirst(ProxyHeaders.X_COPY_FROM_ACCOUNT);
        srcAccount = srcAccount != null ? CopyPaths.checkAccountFormat(srcAccount) : destination.getAccount();
        CopyPaths.Target source = CopyPaths.checkPathHeader(request, ProxyHeaders.X_COPY_FROM);
        RequestPath sourcePath = RequestPath.of(destination.getVersion(), srcAccount,
                source.container(), source.object());

        log.debug("Server-side copy {} -> {}", sourcePath, destination);
        return copyOrchestrator.copy(sourcePath, request, next);
    }

    private static boolean hasBody(ProxyRequest request) {
        return request.getContentLength() > 0 || request.isChunked();
    }

    @Override
    public int getOrder() {
        return 0;
    }
}
