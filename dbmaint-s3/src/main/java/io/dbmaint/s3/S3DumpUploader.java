package io.dbmaint.s3;

import io.dbmaint.spi.DumpUploader;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DumpUploader} that stores dumps in an S3 bucket.
 *
 * <p>The client is built on the first upload. SDK failures, including a client that cannot be
 * configured (no resolvable region, for example), are reported as {@link IOException} so the caller
 * can keep the local file. The uploader owns its client; close it when the run is over.
 */
public final class S3DumpUploader implements DumpUploader, AutoCloseable {
    private static final Logger logger = Logger.getLogger(S3DumpUploader.class.getName());

    private final Supplier<S3Client> clientFactory;
    private final String bucket;
    private S3Client client;

    public S3DumpUploader(S3Client client, String bucket) {
        this(constant(Objects.requireNonNull(client, "client")), bucket);
        this.client = client;
    }

    S3DumpUploader(Supplier<S3Client> clientFactory, String bucket) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        if (bucket.isBlank()) {
            throw new IllegalArgumentException("bucket must not be blank");
        }
    }

    /**
     * Creates an uploader for {@code bucket} in {@code region}.
     *
     * <p>With both key parts given, static credentials are used; otherwise the SDK's default
     * provider chain resolves them. A {@code null} region is resolved by the SDK's region chain.
     */
    public static S3DumpUploader create(String bucket, String region, String accessKeyId, String secretAccessKey) {
        AwsCredentialsProvider credentials = accessKeyId != null && secretAccessKey != null
                ? StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey))
                : DefaultCredentialsProvider.create();
        return new S3DumpUploader(() -> {
            S3ClientBuilder builder = S3Client.builder().credentialsProvider(credentials);
            if (region != null && !region.isBlank()) {
                builder.region(Region.of(region));
            }
            return builder.build();
        }, bucket);
    }

    private static Supplier<S3Client> constant(S3Client client) {
        return () -> client;
    }

    @Override
    public void upload(Path file, String key) throws IOException {
        logger.log(Level.INFO, "Uploading {0} to {1}/{2}", new Object[]{file, describeTarget(), key});
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("application/gzip")
                .build();
        try {
            client().putObject(request, RequestBody.fromFile(file));
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public String describeTarget() {
        return "s3://" + bucket;
    }

    private S3Client client() {
        if (client == null) {
            client = clientFactory.get();
        }
        return client;
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
