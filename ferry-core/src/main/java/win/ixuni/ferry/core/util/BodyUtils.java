package win.ixuni.ferry.core.util;

import org.reactivestreams.Subscription;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Request/response body helpers
 */
public final class BodyUtils {

    private BodyUtils() {
    }

    public static Flux<ByteBuffer> of(byte[] data) {
        if (data.length == 0) {
            return Flux.empty();
        }
        return Flux.defer(() -> Flux.just(ByteBuffer.wrap(data)));
    }

    public static Flux<ByteBuffer> of(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 将 DataBuffer 流转换为 ByteBuffer 流，逐块复制后立即释放
     */
    public static Flux<ByteBuffer> fromDataBuffers(Flux<DataBuffer> buffers) {
        return buffers.map(dataBuffer -> {
            byte[] bytes = new byte[dataBuffer.readableByteCount()];
            dataBuffer.read(bytes);
            DataBufferUtils.release(dataBuffer);
            return ByteBuffer.wrap(bytes);
        }).doOnDiscard(DataBuffer.class, DataBufferUtils::release);
    }

    /**
     * Buffer a whole body into memory
     */
    public static Mono<byte[]> join(Flux<ByteBuffer> body) {
        return body
                .reduceWith(ByteArrayOutputStream::new, (baos, buf) -> {
                    ByteBuffer slice = buf.duplicate();
                    byte[] bytes = new byte[slice.remaining()];
                    slice.get(bytes);
                    baos.write(bytes, 0, bytes.length);
                    return baos;
                })
                .map(ByteArrayOutputStream::toByteArray)
                .defaultIfEmpty(new byte[0]);
    }

    /**
     * Buffer a body of at most {@code maxBytes} bytes
     * <p>
     * Stops reading and signals the supplied error as soon as the limit is
     * passed, so an oversized body is never held in memory.
     */
    public static Mono<byte[]> join(Flux<ByteBuffer> body, long maxBytes, Supplier<? extends Throwable> tooLarge) {
        return join(Flux.defer(() -> {
            AtomicLong total = new AtomicLong();
            return body.<ByteBuffer>handle((buf, sink) -> {
                if (total.addAndGet(buf.remaining()) > maxBytes) {
                    sink.error(tooLarge.get());
                } else {
                    sink.next(buf);
                }
            });
        }));
    }

    /**
     * Cancel a body that will not be read
     */
    public static void discard(Flux<ByteBuffer> body) {
        body.subscribe(new BaseSubscriber<ByteBuffer>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                subscription.cancel();
            }
        });
    }

    public static Mono<String> joinAsString(Flux<ByteBuffer> body) {
        return join(body).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }
}
