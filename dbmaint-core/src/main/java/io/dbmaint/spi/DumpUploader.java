package io.dbmaint.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Uploads a finished dump file to object storage.
 *
 * <p>Upload failures are reported by the backup gate but never abort the table, because the
 * local dump has already been written.
 *
 * <p>Implemented by {@code io.dbmaint.s3.S3DumpUploader}.
 */
public interface DumpUploader {

    /**
     * Uploads {@code localFile} under {@code key}.
     *
     * @throws IOException if the upload fails
     */
    void upload(Path localFile, String key) throws IOException;

    /**
     * Human-readable destination (e.g. {@code s3://bucket}) used in log lines.
     */
    String describeTarget();
}
