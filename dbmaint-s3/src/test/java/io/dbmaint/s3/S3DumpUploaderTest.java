package io.dbmaint.s3;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class S3DumpUploaderTest {

    @TempDir
    Path dir;

    @Test
    void putsFileUnderKey() throws Exception {
        StubS3Client client = new StubS3Client();
        Path file = Files.write(dir.resolve("shop_orders.sql.gz"), new byte[]{1, 2, 3});

        new S3DumpUploader(client, "backups").upload(file, "db_dumps/shop_orders.sql.gz");

        assertEquals(1, client.requests.size());
        assertEquals("backups", client.requests.get(0).bucket());
        assertEquals("db_dumps/shop_orders.sql.gz", client.requests.get(0).key());
        assertArrayEquals(new byte[]{1, 2, 3}, client.bodies.get(0));
    }

    @Test
    void sdkFailureBecomesIoException() throws Exception {
        StubS3Client client = new StubS3Client();
        client.failure = SdkClientException.create("Unable to execute HTTP request");
        Path file = Files.write(dir.resolve("x.sql.gz"), new byte[]{0});

        IOException e = assertThrows(IOException.class,
                () -> new S3DumpUploader(client, "backups").upload(file, "db_dumps/x.sql.gz"));

        assertEquals("Unable to execute HTTP request", e.getMessage());
    }

    @Test
    void describesBucket() {
        assertEquals("s3://backups", new S3DumpUploader(new StubS3Client(), "backups").describeTarget());
    }

    @Test
    void rejectsBlankBucket() {
        assertThrows(IllegalArgumentException.class, () -> new S3DumpUploader(new StubS3Client(), " "));
    }

    @Test
    void closeClosesClient() {
        StubS3Client client = new StubS3Client();
        new S3DumpUploader(client, "backups").close();
        assertTrue(client.closed);
    }

    @Test
    void clientIsBuiltOnFirstUpload() throws Exception {
        StubS3Client client = new StubS3Client();
        int[] builds = {0};
        S3DumpUploader uploader = new S3DumpUploader(() -> {
            builds[0]++;
            return client;
        }, "backups");
        assertEquals("s3://backups", uploader.describeTarget());
        assertEquals(0, builds[0]);

        Path file = Files.write(dir.resolve("a.sql.gz"), new byte[]{1});
        uploader.upload(file, "db_dumps/a.sql.gz");
        uploader.upload(file, "db_dumps/b.sql.gz");

        assertEquals(1, builds[0]);
        assertEquals(2, client.requests.size());
        uploader.close();
        assertTrue(client.closed);
    }

    @Test
    void clientSetupFailureBecomesIoException() throws Exception {
        S3DumpUploader uploader = new S3DumpUploader(() -> {
            throw SdkClientException.create("Unable to load region from any of the providers in the chain");
        }, "backups");
        Path file = Files.write(dir.resolve("x.sql.gz"), new byte[]{0});

        IOException e = assertThrows(IOException.class, () -> uploader.upload(file, "db_dumps/x.sql.gz"));

        assertTrue(e.getMessage().startsWith("Unable to load region"));
        uploader.close();
    }

    @Test
    void createDoesNotResolveRegionUpFront() {
        try (S3DumpUploader uploader = S3DumpUploader.create("backups", null, "key", "secret")) {
            assertEquals("s3://backups", uploader.describeTarget());
        }
    }

    static final class StubS3Client implements S3Client {
        final List<PutObjectRequest> requests = new ArrayList<>();
        final List<byte[]> bodies = new ArrayList<>();
        RuntimeException failure;
        boolean closed;

        @Override
        public PutObjectResponse putObject(PutObjectRequest request, RequestBody body) {
            if (failure != null) {
                throw failure;
            }
            requests.add(request);
            try (InputStream in = body.contentStreamProvider().newStream()) {
                bodies.add(in.readAllBytes());
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            return PutObjectResponse.builder().build();
        }

        @Override
        public String serviceName() {
            return "s3";
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
