package io.dbmaint.dump;

import io.dbmaint.ExecutionMode;
import io.dbmaint.ResultLog;
import io.dbmaint.model.DumpRequest;
import io.dbmaint.model.DumpStorage;
import io.dbmaint.spi.DumpUploader;
import io.dbmaint.spi.MetricsExporter;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;

/**
 * Takes a compressed dump of a table before any destructive step runs on it.
 *
 * <p>The dump utility's standard output is streamed through GZIP straight into
 * {@code <db>_<table>_<yyyyMMdd_HHmmss>.sql.gz}; no uncompressed copy touches the disk. A non-zero
 * exit status or a stream error deletes the partial file and yields {@link DumpResult.Failed},
 * which the caller must treat as fatal for the table.
 *
 * <p>For {@link DumpStorage#S3} the finished file is uploaded under {@value #REMOTE_PREFIX} and then
 * removed locally. An upload failure is reported but keeps the local file and still counts as a
 * successful dump.
 *
 * <p>In dry-run only the masked command is logged and {@link DumpResult.Simulated} is returned so
 * that the remaining steps are simulated as well.
 */
public final class BackupGate {
    private static final Logger logger = Logger.getLogger(BackupGate.class.getName());

    public static final String REMOTE_PREFIX = "db_dumps/";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ExecutionMode mode;
    private final ConnectionParams connectionParams;
    private final DumpUploader uploader;
    private final ProcessLauncher launcher;
    private final Clock clock;
    private final MetricsExporter metrics;

    /**
     * @param uploader object storage client; {@code null} if remote storage is not configured
     */
    public BackupGate(ExecutionMode mode, ConnectionParams connectionParams, DumpUploader uploader,
            ProcessLauncher launcher, Clock clock, MetricsExporter metrics) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.connectionParams = Objects.requireNonNull(connectionParams, "connectionParams");
        this.uploader = uploader;
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Dumps {@code database.table} as requested.
     *
     * @return {@link DumpResult.Failed} if no usable dump exists; success otherwise
     */
    public DumpResult dumpTable(String database, String table, DumpRequest request, ResultLog results) {
        String fileName = fileName(database, table);
        Path file = request.directory().resolve(fileName);
        DumpCommand command = DumpCommand.of(connectionParams, database, table, file);

        if (mode.isDryRun()) {
            logger.log(Level.INFO, "[DRY RUN] Would execute dump command: {0}", command.masked());
            if (request.storage() == DumpStorage.S3) {
                logger.log(Level.INFO, "[DRY RUN] Would upload {0} to {1} as {2}",
                        new Object[]{file, describeUploadTarget(), REMOTE_PREFIX + fileName});
            }
            results.info("[DRY RUN] Simulated dump of `" + database + "`.`" + table + "` to " + file);
            return new DumpResult.Simulated(file);
        }

        logger.log(Level.INFO, "Dumping table `{0}`.`{1}` to {2}", new Object[]{database, table, file});
        logger.log(Level.FINE, "Dump command: {0}", command.masked());
        try {
            Files.createDirectories(request.directory());
            writeDump(command, file);
        } catch (DumpFailure | IOException e) {
            logger.log(Level.SEVERE, "Error dumping table `" + table + "`: " + e.getMessage());
            metrics.incrementDumpsFailed();
            return new DumpResult.Failed(e.getMessage());
        }
        metrics.incrementDumpsCompleted();
        results.info("Dumped `" + database + "`.`" + table + "` to " + file);

        if (request.storage() == DumpStorage.S3) {
            return upload(file, REMOTE_PREFIX + fileName, results);
        }
        return new DumpResult.Completed(file, Optional.empty());
    }

    String fileName(String database, String table) {
        return database + "_" + table + "_" + LocalDateTime.now(clock).format(TIMESTAMP) + ".sql.gz";
    }

    private void writeDump(DumpCommand command, Path file) throws DumpFailure {
        Process process;
        try {
            process = launcher.start(command.arguments());
        } catch (IOException e) {
            throw new DumpFailure("could not start " + connectionParams.dumpExecutable() + ": " + e.getMessage());
        }
        try {
            try (InputStream in = process.getInputStream();
                 OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
                in.transferTo(out);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                deletePartial(file);
                throw new DumpFailure(connectionParams.dumpExecutable() + " exited with status " + exitCode);
            }
        } catch (IOException e) {
            process.destroyForcibly();
            deletePartial(file);
            throw new DumpFailure("failed to write " + file + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            deletePartial(file);
            throw new DumpFailure("interrupted while waiting for " + connectionParams.dumpExecutable());
        }
    }

    private DumpResult upload(Path file, String key, ResultLog results) {
        if (uploader == null) {
            results.error("Error uploading " + file + ": no object storage configured; dump kept locally");
            return new DumpResult.Completed(file, Optional.empty());
        }
        try {
            uploader.upload(file, key);
        } catch (IOException | RuntimeException e) {
            results.error("Error uploading " + file + " to " + uploader.describeTarget() + ": " + e.getMessage());
            return new DumpResult.Completed(file, Optional.empty());
        }
        results.info("Uploaded " + file + " to " + uploader.describeTarget() + " as " + key);
        try {
            Files.delete(file);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Uploaded dump could not be removed locally: " + file, e);
        }
        return new DumpResult.Completed(file, Optional.of(key));
    }

    private String describeUploadTarget() {
        return uploader != null ? uploader.describeTarget() : "<no object storage configured>";
    }

    private static void deletePartial(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to delete partial dump " + file, e);
        }
    }

    private static final class DumpFailure extends Exception {
        DumpFailure(String message) {
            super(message);
        }
    }
}
