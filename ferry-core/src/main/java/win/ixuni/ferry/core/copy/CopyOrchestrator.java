package win.ixuni.ferry.core.copy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.exception.EntityTooLargeException;
import win.ixuni.ferry.core.http.MetadataHeaders;
import win.ixuni.ferry.core.http.ProxyHeaders;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.http.RequestContext;
import win.ixuni.ferry.core.http.RequestPath;
import win.ixuni.ferry.core.pipeline.ProxyHandler;

import java.nio.charset.StandardCharsets;
import java.util.function.Predicate;

/**
 * 服务端复制
 * <p>
 * Fetches the source object with one GET sub-request and writes it to the
 * destination with one PUT sub-request. Nothing is retried; the first
 * failure is what the client sees.
 */
@Slf4j
@RequiredArgsConstructor
public class CopyOrchestrator {

    static final String SOURCE_TAG = "SSC";

    /**
     * Largest source object that may be copied, in bytes
     */
    private final long maxFileSize;

    /**
     * Copy the object at {@code sourcePath} to the path of {@code request}
     *
     * @param sourcePath where to read from, possibly in another account
     * @param request    a PUT carrying {@code X-Copy-From}
     * @param next       the handler sub-requests are sent to
     * @return the response of the sink PUT, or the source response when the fetch failed
     */
    public Mono<ProxyResponse> copy(RequestPath sourcePath, ProxyRequest request, ProxyHandler next) {
        return getSourceObject(sourcePath, request, next)
                .flatMap(sourceResponse -> {
                    if (sourceResponse.getStatus() >= 300) {
                        log.debug("Copy source {} answered {}", sourcePath, sourceResponse.getStatus());
                        return Mono.just(sourceResponse);
                    }
                    return sendSinkRequest(sourcePath, sourceResponse, request, next);
                });
    }

    private Mono<ProxyResponse> getSourceObject(RequestPath sourcePath, ProxyRequest request, ProxyHandler next) {
        HttpHeaders sourceHeaders = new HttpHeaders();
        sourceHeaders.addAll(request.getHeaders());
        sourceHeaders.remove(HttpHeaders.CONTENT_LENGTH);
        // the source must be read with its own container's policy
        sourceHeaders.remove(ProxyHeaders.X_BACKEND_STORAGE_POLICY_INDEX);
        sourceHeaders.set(ProxyHeaders.X_NEWEST, "true");

        ProxyRequest sourceRequest = request.subRequest("GET", sourcePath.toPath(), sourceHeaders, SOURCE_TAG);
        CopyHook hook = request.getContext().getCopyHook();

        return next.handle(sourceRequest)
                .flatMap(sourceResponse -> hook == null
                        ? Mono.just(sourceResponse)
                        : hook.apply(sourceRequest, sourceResponse, request))
                .flatMap(sourceResponse -> {
                    long length = sourceResponse.getContentLength();
                    if (length < 0) {
                        // chunked source, e.g. a large object with too many segments
                        sourceResponse.discardBody();
                        return Mono.error(new EntityTooLargeException(
                                "Copy source has no content length: " + sourcePath));
                    }
                    if (length > maxFileSize) {
                        sourceResponse.discardBody();
                        return Mono.error(new EntityTooLargeException(
                                "Copy source of " + length + " bytes exceeds " + maxFileSize));
                    }
                    return Mono.just(sourceResponse);
                });
    }

    private Mono<ProxyResponse> sendSinkRequest(RequestPath sourcePath, ProxyResponse sourceResponse,
                                                ProxyRequest request, ProxyHandler next) {
        RequestContext context = request.getContext();

        // Create the sink from the original request, preserving context and headers
        HttpHeaders sinkHeaders = new HttpHeaders();
        sinkHeaders.addAll(request.getHeaders());
        sinkHeaders.setContentLength(sourceResponse.getContentLength());
        String etag = sourceResponse.getHeader(ProxyHeaders.ETAG);
        if (etag != null) {
            sinkHeaders.set(ProxyHeaders.ETAG, etag);
        } else {
            sinkHeaders.remove(ProxyHeaders.ETAG);
        }
        sinkHeaders.remove(ProxyHeaders.X_COPY_FROM);
        sinkHeaders.remove(ProxyHeaders.X_COPY_FROM_ACCOUNT);

        if (!StringUtils.hasText(request.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE))) {
            String sourceType = sourceResponse.getHeader(HttpHeaders.CONTENT_TYPE);
            if (sourceType != null) {
                sinkHeaders.set(HttpHeaders.CONTENT_TYPE, sourceType);
            }
        }

        boolean freshMetadata = ProxyHeaders.isTrue(sinkHeaders.getFirst(ProxyHeaders.X_FRESH_METADATA));
        if (freshMetadata || context.isPostAsCopy()) {
            // ignore new sysmeta, keep the existing one
            Predicate<String> sysMeta = key -> MetadataHeaders.isSysMeta(MetadataHeaders.OBJECT, key);
            MetadataHeaders.removeItems(sinkHeaders, sysMeta);
            MetadataHeaders.copyHeaderSubset(sourceResponse.getHeaders(), sinkHeaders, sysMeta);
        } else {
            MetadataHeaders.copyHeadersInto(sourceResponse.getHeaders(), sinkHeaders);
            MetadataHeaders.copyHeadersInto(request.getHeaders(), sinkHeaders);
        }

        String slo = sourceResponse.getHeader(ProxyHeaders.X_STATIC_LARGE_OBJECT);
        if (slo != null && ("get".equals(request.getQueryParam(ProxyHeaders.MULTIPART_MANIFEST))
                || context.isPostAsCopy())) {
            sinkHeaders.set(ProxyHeaders.X_STATIC_LARGE_OBJECT, slo);
        }

        HttpHeaders responseHeaders = createResponseHeaders(sourcePath, sourceResponse, sinkHeaders);

        ProxyRequest sinkRequest = ProxyRequest.builder()
                .method("PUT")
                .path(request.getPath())
                .headers(sinkHeaders)
                .queryParams(new LinkedMultiValueMap<>(request.getQueryParams()))
                .body(sourceResponse.getBody())
                .context(context)
                .build();

        log.debug("Copying {} -> {} ({} bytes)", sourcePath, request.getPath(), sourceResponse.getContentLength());
        return next.handle(sinkRequest)
                .map(response -> adjustPutResponse(response, responseHeaders, context.getOriginalMethod()));
    }

    private HttpHeaders createResponseHeaders(RequestPath sourcePath, ProxyResponse sourceResponse,
                                              HttpHeaders sinkHeaders) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ProxyHeaders.X_COPIED_FROM_ACCOUNT,
                UriUtils.encodePath(sourcePath.getAccount(), StandardCharsets.UTF_8));
        headers.set(ProxyHeaders.X_COPIED_FROM,
                UriUtils.encodePath(sourcePath.containerAndObject(), StandardCharsets.UTF_8));
        String lastModified = sourceResponse.getHeader(HttpHeaders.LAST_MODIFIED);
        if (lastModified != null) {
            headers.set(ProxyHeaders.X_COPIED_FROM_LAST_MODIFIED, lastModified);
        }
        // existing sys and user meta of the source, plus the new ones
        MetadataHeaders.copyHeadersInto(sinkHeaders, headers);
        return headers;
    }

    private ProxyResponse adjustPutResponse(ProxyResponse response, HttpHeaders additionalHeaders,
                                            String originalMethod) {
        if (response.isSuccess()) {
            response.getHeaders().putAll(additionalHeaders);
        }
        // Older clients expect 202 Accepted on object POST
        if ("POST".equals(originalMethod) && response.getStatus() == 201) {
            response.setStatus(202);
        }
        return response;
    }
}
