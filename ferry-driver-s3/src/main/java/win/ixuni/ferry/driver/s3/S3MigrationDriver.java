package win.ixuni.ferry.driver.s3;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.ferry.core.exception.MigrationDriverException;
import win.ixuni.ferry.core.migration.driver.MigratedObject;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * S3 迁移驱动
 * <p>
 * Migrates objects from a bucket of an S3-compatible store. The container's
 * migration source is the bucket name; endpoint and credentials come from
 * the container's migration metadata.
 */
@Slf4j
public class S3MigrationDriver implements MigrationDriver {

    public static final String ENDPOINT = "endpoint";
    public static final String ACCESS_KEY = "access-key";
    public static final String SECRET_KEY = "secret-key";
    public static final String REGION = "region";
    public static final String PATH_STYLE = "path-style";

    private final String bucket;
    private final S3AsyncClient s3Client;

    public S3MigrationDriver(String bucket, MigrationParameters params) {
        if (bucket == null || bucket.isBlank()) {
            throw new MigrationDriverException("Migration source " + bucket + " is invalid");
        }
        this.bucket = bucket;
        this.s3Client = buildS3Client(params);
    }

    S3MigrationDriver(String bucket, S3AsyncClient s3Client) {
        this.bucket = bucket;
        this.s3Client = s3Client;
    }

    private S3AsyncClient buildS3Client(MigrationParameters params) {
        String endpoint = params.get(ENDPOINT);
        String accessKey = params.require(ACCESS_KEY);
        String secretKey = params.require(SECRET_KEY);
        String region = params.get(REGION, "us-east-1");
        boolean pathStyle = params.getBoolean(PATH_STYLE, true);

        try {
            var builder = S3AsyncClient.builder()
                    .region(Region.of(region))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create(accessKey, secretKey)))
                    .forcePathStyle(pathStyle);

            if (endpoint != null && !endpoint.isBlank()) {
                builder.endpointOverride(URI.create(endpoint));
            }
            return builder.build();
        } catch (RuntimeException e) {
            throw new MigrationDriverException("Invalid S3 parameters: " + e.getMessage(), e);
        }
    }

    @Override
    public Mono<MigratedObject> fetch(String objectName) {
        return Mono.fromFuture(() -> s3Client.getObject(
                        GetObjectRequest.builder()
                                .bucket(bucket)
                                .key(objectName)
                                .build(),
                        AsyncResponseTransformer.toPublisher()))
                .map(publisher -> {
                    GetObjectResponse response = publisher.response();
                    Map<String, String> metadata = new LinkedHashMap<>(response.metadata());
                    return MigratedObject.builder()
                            .metadata(metadata)
                            .size(response.contentLength() != null ? response.contentLength() : -1)
                            .content(Flux.from(publisher))
                            .contentType(response.contentType())
                            .timestamp(response.lastModified())
                            .build();
                })
                .onErrorMap(e -> !(e instanceof MigrationDriverException), this::translateException);
    }

    private Throwable translateException(Throwable e) {
        if (e instanceof S3Exception s3) {
            String errorCode = s3.awsErrorDetails() != null ? s3.awsErrorDetails().errorCode() : "";
            log.debug("S3 GET failed: {} (HTTP {})", errorCode, s3.statusCode());
            return new MigrationDriverException("Object GET failed: " + errorCode, e);
        }
        return new MigrationDriverException("Connection failed to S3: " + e.getMessage(), e);
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
