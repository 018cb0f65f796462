package win.ixuni.ferry.core.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.exception.PreconditionFailedException;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static win.ixuni.ferry.core.support.TestRequests.*;

class MiddlewarePipelineTest {

    private static ProxyMiddleware tracing(List<String> trace, String name, int order) {
        return new ProxyMiddleware() {
            @Override
            public Mono<ProxyResponse> intercept(ProxyRequest request, ProxyHandler next) {
                trace.add(name);
                return next.handle(request);
            }

            @Override
            public int getOrder() {
                return order;
            }
        };
    }

    @Test
    @DisplayName("中间件按 order 从小到大执行")
    void testPipeline_Ordering() {
        List<String> trace = new ArrayList<>();
        ProxyHandler terminal = request -> {
            trace.add("backend");
            return Mono.just(ProxyResponse.of(204));
        };
        MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(
                tracing(trace, "copy", 0),
                tracing(trace, "errors", -300),
                tracing(trace, "migration", -100)), terminal);

        ProxyResponse response = call(pipeline, request("GET", "/v1/a/c/o"));

        assertEquals(204, response.getStatus());
        assertEquals(List.of("errors", "migration", "copy", "backend"), trace);
        assertEquals(3, pipeline.getMiddlewares().size());
    }

    @Test
    @DisplayName("FerryException 转换为对应状态码的文本响应")
    void testErrorTranslation_FerryException() {
        ProxyHandler failing = request -> {
            throw new PreconditionFailedException("Destination header required");
        };
        MiddlewarePipeline pipeline = new MiddlewarePipeline(
                List.of(new ErrorTranslationMiddleware(), new RequestLoggingMiddleware()), failing);

        ProxyResponse response = call(pipeline, request("COPY", "/v1/a/c/o"));

        assertEquals(412, response.getStatus());
        assertEquals("Destination header required", body(response));
    }

    @Test
    @DisplayName("未知异常转换为 500")
    void testErrorTranslation_UnexpectedError() {
        ProxyHandler failing = request -> Mono.error(new IllegalStateException("boom"));
        MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(new ErrorTranslationMiddleware()), failing);

        ProxyResponse response = call(pipeline, request("GET", "/v1/a/c/o"));

        assertEquals(500, response.getStatus());
        assertEquals("An internal error occurred", body(response));
    }
}
