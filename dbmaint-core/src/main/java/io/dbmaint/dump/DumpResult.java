package io.dbmaint.dump;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link BackupGate#dumpTable}.
 *
 * <ul>
 *   <li>{@link Completed}: dump written; for remote storage it may also have been uploaded.</li>
 *   <li>{@link Simulated}: dry-run; nothing was written, processing continues.</li>
 *   <li>{@link Failed}: no usable dump exists; the table's remaining steps must not run.</li>
 * </ul>
 */
public sealed interface DumpResult permits DumpResult.Completed, DumpResult.Simulated, DumpResult.Failed {

    /**
     * Whether destructive steps may proceed.
     */
    boolean succeeded();

    /**
     * @param file      local dump file; for uploaded dumps this file has already been removed
     * @param remoteKey object key when the upload succeeded
     */
    record Completed(Path file, Optional<String> remoteKey) implements DumpResult {
        public Completed {
            Objects.requireNonNull(file, "file");
            remoteKey = remoteKey != null ? remoteKey : Optional.empty();
        }

        @Override
        public boolean succeeded() {
            return true;
        }
    }

    record Simulated(Path plannedFile) implements DumpResult {
        public Simulated {
            Objects.requireNonNull(plannedFile, "plannedFile");
        }

        @Override
        public boolean succeeded() {
            return true;
        }
    }

    record Failed(String reason) implements DumpResult {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean succeeded() {
            return false;
        }
    }
}
