package io.dbmaint.run;

import io.dbmaint.ExecutionMode;
import io.dbmaint.ResultLog;
import io.dbmaint.SessionException;
import io.dbmaint.audit.ForeignKeyAuditor;
import io.dbmaint.delete.BatchedDeletionEngine;
import io.dbmaint.delete.Pacer;
import io.dbmaint.dump.BackupGate;
import io.dbmaint.dump.ConnectionParams;
import io.dbmaint.dump.ProcessLauncher;
import io.dbmaint.model.DatabaseGroup;
import io.dbmaint.model.MaintenanceRun;
import io.dbmaint.model.TableSpec;
import io.dbmaint.spi.DumpUploader;
import io.dbmaint.spi.MetricsExporter;
import io.dbmaint.spi.SessionProvider;
import io.dbmaint.spi.SqlSession;
import io.dbmaint.sql.SqlExecutionException;
import io.dbmaint.sql.SqlExecutor;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a whole maintenance run over one database session.
 *
 * <p>Database groups and their tables are processed strictly in configuration order. Before a
 * group's tables, its database is selected on the session; if that fails the group is skipped and
 * the run continues with the next one. Selection and catalog reads are not mutating and run in
 * dry-run too. The session is closed when the run ends, whatever the outcome.
 *
 * <p>An unexpected error while processing one table ends that table only.
 *
 * <p>At the end the complete result log is written to the diagnostic log under
 * {@code Maintenance Results:}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see RunCoordinator.Builder
 * @see TableProcessor
 */
public final class RunCoordinator {
    private static final Logger logger = Logger.getLogger(RunCoordinator.class.getName());

    private final SessionProvider sessionProvider;
    private final ExecutionMode mode;
    private final TableProcessor processor;

    private RunCoordinator(Builder builder) {
        this.sessionProvider = Objects.requireNonNull(builder.sessionProvider, "sessionProvider");
        this.mode = builder.mode != null ? builder.mode : ExecutionMode.LIVE;
        ConnectionParams connectionParams = Objects.requireNonNull(builder.connectionParams, "connectionParams");
        MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        Clock clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
        ProcessLauncher launcher = builder.processLauncher != null ? builder.processLauncher : ProcessLauncher.SYSTEM;
        Pacer pacer = builder.pacer != null ? builder.pacer : Pacer.SLEEP;

        SqlExecutor executor = new SqlExecutor(mode);
        this.processor = new TableProcessor(
                new BackupGate(mode, connectionParams, builder.uploader, launcher, clock, metrics),
                new ForeignKeyAuditor(),
                new BatchedDeletionEngine(executor, pacer, clock, metrics),
                executor,
                metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Executes every configured group and table.
     *
     * @return the run summary; never throws for database errors
     */
    public RunReport run(MaintenanceRun config) {
        Objects.requireNonNull(config, "config");
        ResultLog results = new ResultLog();
        if (mode.isDryRun()) {
            logger.info("Running in dry-run mode: no data will be changed");
        }

        final SqlSession session;
        try {
            session = sessionProvider.openSession();
        } catch (SessionException e) {
            logger.log(Level.SEVERE, "Error connecting to database", e);
            results.error("Error connecting to database: " + e.getMessage());
            return finish(new Tally(), results, true, false);
        }
        logger.info("Successfully connected to the database");

        Tally tally = new Tally();
        boolean runFailed = false;
        try (session) {
            for (DatabaseGroup group : config.databases()) {
                processGroup(session, group, results, tally);
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Maintenance run ended unexpectedly", e);
            results.error("Maintenance run ended unexpectedly: " + e.getMessage());
            runFailed = true;
        }
        logger.info("Database session closed");
        return finish(tally, results, false, runFailed);
    }

    private void processGroup(SqlSession session, DatabaseGroup group, ResultLog results, Tally tally) {
        String database = group.database();
        try {
            session.execute(session.dialect().useDatabase(database));
            results.info("Using database `" + database + "`");
        } catch (SqlExecutionException e) {
            results.error("Error selecting database `" + database + "`: " + e.getMessage());
            tally.groupsSkipped++;
            return;
        }
        for (TableSpec table : group.tables()) {
            try {
                tally.record(processor.process(session, database, table, results));
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error processing table " + table.name(), e);
                results.error("Unexpected error processing table `" + database + "`.`" + table.name() + "`: "
                        + e.getMessage());
                tally.record(TableStatus.ABORTED);
            }
        }
    }

    private static RunReport finish(Tally tally, ResultLog results, boolean connectionFailed, boolean runFailed) {
        logger.info("Maintenance Results:");
        for (String entry : results.entries()) {
            logger.info(entry);
        }
        return new RunReport(results.entries(), tally.processed, tally.aborted, tally.withErrors,
                tally.groupsSkipped, connectionFailed, runFailed);
    }

    private static final class Tally {
        int processed;
        int aborted;
        int withErrors;
        int groupsSkipped;

        void record(TableStatus status) {
            processed++;
            if (status == TableStatus.ABORTED) {
                aborted++;
            } else if (status == TableStatus.COMPLETED_WITH_ERRORS) {
                withErrors++;
            }
        }
    }

    /** Builder for {@link RunCoordinator}. */
    public static final class Builder {
        private SessionProvider sessionProvider;
        private ExecutionMode mode;
        private ConnectionParams connectionParams;
        private DumpUploader uploader;
        private ProcessLauncher processLauncher;
        private Pacer pacer;
        private Clock clock;
        private MetricsExporter metrics;

        private Builder() {}

        /**
         * Sets the source of the run's single database session.
         *
         * <p><b>Required.</b>
         *
         * @param sessionProvider the session provider
         * @return this builder
         */
        public Builder sessionProvider(SessionProvider sessionProvider) {
            this.sessionProvider = sessionProvider;
            return this;
        }

        /**
         * Sets live or dry-run execution.
         *
         * <p>Optional. Defaults to {@link ExecutionMode#LIVE}.
         *
         * @param mode the execution mode
         * @return this builder
         */
        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Sets the credentials handed to the dump utility.
         *
         * <p><b>Required.</b>
         *
         * @param connectionParams host, port, user, password and dump executable
         * @return this builder
         */
        public Builder connectionParams(ConnectionParams connectionParams) {
            this.connectionParams = connectionParams;
            return this;
        }

        /**
         * Sets the object storage client for dumps stored remotely.
         *
         * <p>Optional. Without one, remote dumps are kept locally and an error is reported.
         *
         * @param uploader the uploader
         * @return this builder
         */
        public Builder uploader(DumpUploader uploader) {
            this.uploader = uploader;
            return this;
        }

        /**
         * Sets how the dump utility is started.
         *
         * <p>Optional. Defaults to {@link ProcessLauncher#SYSTEM}.
         *
         * @param processLauncher the launcher
         * @return this builder
         */
        public Builder processLauncher(ProcessLauncher processLauncher) {
            this.processLauncher = processLauncher;
            return this;
        }

        /**
         * Sets how the delay between delete batches is applied.
         *
         * <p>Optional. Defaults to {@link Pacer#SLEEP}.
         *
         * @param pacer the pacer
         * @return this builder
         */
        public Builder pacer(Pacer pacer) {
            this.pacer = pacer;
            return this;
        }

        /**
         * Sets the clock used for dump timestamps and age thresholds.
         *
         * <p>Optional. Defaults to the system clock in the default time zone.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the coordinator.
         *
         * @return a new {@link RunCoordinator}
         * @throws NullPointerException if {@code sessionProvider} or {@code connectionParams} is null
         */
        public RunCoordinator build() {
            return new RunCoordinator(this);
        }
    }
}
