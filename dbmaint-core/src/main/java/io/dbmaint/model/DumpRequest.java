package io.dbmaint.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Request to dump a table before any destructive step.
 *
 * @param storage   where the dump ends up
 * @param directory local destination for {@link DumpStorage#LOCAL}, local staging directory for
 *                  {@link DumpStorage#S3}
 */
public record DumpRequest(DumpStorage storage, Path directory) {

    public static final Path DEFAULT_DIRECTORY = Path.of(".");

    public DumpRequest {
        Objects.requireNonNull(storage, "storage");
        directory = directory != null ? directory : DEFAULT_DIRECTORY;
    }

    public static DumpRequest local(Path directory) {
        return new DumpRequest(DumpStorage.LOCAL, directory);
    }

    public static DumpRequest s3(Path stagingDirectory) {
        return new DumpRequest(DumpStorage.S3, stagingDirectory);
    }
}
