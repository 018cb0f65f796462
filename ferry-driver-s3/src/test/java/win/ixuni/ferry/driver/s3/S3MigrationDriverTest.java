package win.ixuni.ferry.driver.s3;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.core.async.ResponsePublisher;
import software.amazon.awssdk.core.async.SdkPublisher;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.ferry.core.exception.MigrationDriverException;
import win.ixuni.ferry.core.migration.driver.MigratedObject;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;
import win.ixuni.ferry.core.util.BodyUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * S3 迁移驱动测试
 */
class S3MigrationDriverTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    /**
     * 只实现 getObject 的客户端
     */
    private static class StubS3Client implements S3AsyncClient {

        private final Function<GetObjectRequest, CompletableFuture<Object>> answer;
        private final AtomicBoolean closed = new AtomicBoolean();
        private GetObjectRequest lastRequest;

        StubS3Client(Function<GetObjectRequest, CompletableFuture<Object>> answer) {
            this.answer = answer;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <ReturnT> CompletableFuture<ReturnT> getObject(GetObjectRequest request,
                                                              AsyncResponseTransformer<GetObjectResponse, ReturnT> transformer) {
            lastRequest = request;
            return (CompletableFuture<ReturnT>) (CompletableFuture<?>) answer.apply(request);
        }

        @Override
        public String serviceName() {
            return SERVICE_NAME;
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }

    @Test
    @DisplayName("读取对象内容和元数据")
    void testFetch() {
        byte[] data = "bucket data".getBytes(StandardCharsets.UTF_8);
        GetObjectResponse response = GetObjectResponse.builder()
                .contentLength((long) data.length)
                .contentType("text/plain")
                .lastModified(Instant.parse("2021-03-04T05:06:07Z"))
                .metadata(Map.of("color", "red"))
                .build();
        StubS3Client client = new StubS3Client(request -> CompletableFuture.completedFuture(
                new ResponsePublisher<>(response, SdkPublisher.adapt(Flux.just(ByteBuffer.wrap(data))))));
        S3MigrationDriver driver = new S3MigrationDriver("legacy-bucket", client);

        MigratedObject object = driver.fetch("a/b.txt").block(TIMEOUT);

        assertNotNull(object);
        assertEquals("legacy-bucket", client.lastRequest.bucket());
        assertEquals("a/b.txt", client.lastRequest.key());
        assertEquals(data.length, object.getSize());
        assertEquals("text/plain", object.getContentType());
        assertEquals("red", object.getMetadata().get("color"));
        assertEquals(Instant.parse("2021-03-04T05:06:07Z"), object.getTimestamp());
        assertEquals("bucket data", BodyUtils.joinAsString(object.getContent()).block(TIMEOUT));

        driver.close();
        assertTrue(client.closed.get());
    }

    @Test
    @DisplayName("S3 错误转换为驱动异常")
    void testFetch_S3Error() {
        S3Exception notFound = (S3Exception) S3Exception.builder()
                .statusCode(404)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("NoSuchKey").build())
                .build();
        S3MigrationDriver driver = new S3MigrationDriver("legacy-bucket",
                new StubS3Client(request -> CompletableFuture.failedFuture(notFound)));

        MigrationDriverException e = assertThrows(MigrationDriverException.class,
                () -> driver.fetch("missing").block(TIMEOUT));
        assertEquals("Object GET failed: NoSuchKey", e.getMessage());
    }

    @Test
    @DisplayName("连接错误转换为驱动异常")
    void testFetch_ConnectionError() {
        S3MigrationDriver driver = new S3MigrationDriver("legacy-bucket",
                new StubS3Client(request -> CompletableFuture.failedFuture(new IllegalStateException("refused"))));

        MigrationDriverException e = assertThrows(MigrationDriverException.class,
                () -> driver.fetch("x").block(TIMEOUT));
        assertEquals("Connection failed to S3: refused", e.getMessage());
    }

    @Test
    @DisplayName("缺少凭证或桶名时拒绝创建驱动")
    void testInvalidParameters() {
        MigrationDriverException noKey = assertThrows(MigrationDriverException.class,
                () -> new S3MigrationDriver("bucket", MigrationParameters.of(Map.of(
                        S3MigrationDriver.ENDPOINT, "http://localhost:9000",
                        S3MigrationDriver.SECRET_KEY, "secret"))));
        assertEquals("Missing value for access-key", noKey.getMessage());

        assertThrows(MigrationDriverException.class,
                () -> new S3MigrationDriver(" ", MigrationParameters.of(Map.of())));
    }

    @Test
    @DisplayName("按参数创建客户端")
    void testFactory() {
        S3MigrationDriverFactory factory = new S3MigrationDriverFactory();
        assertEquals("s3", factory.getDriverType());
        assertTrue(factory.isAvailable());

        var driver = factory.createDriver("bucket", MigrationParameters.of(Map.of(
                S3MigrationDriver.ENDPOINT, "http://localhost:9000",
                S3MigrationDriver.ACCESS_KEY, "key",
                S3MigrationDriver.SECRET_KEY, "secret",
                S3MigrationDriver.REGION, "eu-central-1")));
        assertNotNull(driver);
        driver.close();
    }
}
