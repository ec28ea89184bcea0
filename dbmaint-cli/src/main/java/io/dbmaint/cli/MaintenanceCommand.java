package io.dbmaint.cli;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.dbmaint.ConfigurationException;
import io.dbmaint.ExecutionMode;
import io.dbmaint.dump.ConnectionParams;
import io.dbmaint.jdbc.DataSourceSessionProvider;
import io.dbmaint.micrometer.MicrometerMetricsExporter;
import io.dbmaint.model.DumpStorage;
import io.dbmaint.model.MaintenanceRun;
import io.dbmaint.run.RunCoordinator;
import io.dbmaint.run.RunReport;
import io.dbmaint.s3.S3DumpUploader;
import io.dbmaint.spi.MetricsExporter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(
    name = "dbmaint",
    mixinStandardHelpOptions = true,
    version = "dbmaint 0.1.0",
    description = "Dumps, audits, purges and optimizes database tables as described in a YAML configuration.",
    footer = {
        "",
        "Connection settings default to the environment variables DB_HOST, DB_PORT, DB_USERNAME,",
        "DB_PASSWORD, AWS_BUCKET, AWS_DEFAULT_REGION, AWS_ACCESS_KEY_ID and AWS_SECRET_ACCESS_KEY.",
        "Exit code 0: the run completed (individual tables may have reported errors).",
        "Exit code 1: the configuration could not be loaded or the database was unreachable."
    }
)
public class MaintenanceCommand implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(MaintenanceCommand.class.getName());

    @Option(names = "--dry-run",
        description = "Only log the SQL and dump commands without executing them")
    private boolean dryRun;

    @Option(names = {"-c", "--config"}, defaultValue = ConfigLoader.DEFAULT_CONFIG_FILE,
        description = "Path to YAML configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile;

    @Option(names = "--db-host", defaultValue = "${env:DB_HOST:-localhost}",
        description = "Database host (default: $DB_HOST or localhost)")
    private String host;

    @Option(names = "--db-port", defaultValue = "${env:DB_PORT:-3306}",
        description = "Database port (default: $DB_PORT or 3306)")
    private int port;

    @Option(names = "--db-user", defaultValue = "${env:DB_USERNAME}",
        description = "Database user (default: $DB_USERNAME)")
    private String user;

    @Option(names = "--db-password", defaultValue = "${env:DB_PASSWORD}",
        description = "Database password (default: $DB_PASSWORD)")
    private String password;

    @Option(names = "--jdbc-url",
        description = "JDBC URL; overrides --db-host and --db-port, the SQL dialect is detected from it")
    private String jdbcUrl;

    @Option(names = "--mysqldump", defaultValue = ConnectionParams.DEFAULT_DUMP_EXECUTABLE,
        description = "Dump utility executable (default: ${DEFAULT-VALUE})")
    private String dumpExecutable;

    @Option(names = "--s3-bucket", defaultValue = "${env:AWS_BUCKET}",
        description = "Bucket for dumps with dump_storage: s3 (default: $AWS_BUCKET)")
    private String bucket;

    @Option(names = "--aws-region", defaultValue = "${env:AWS_DEFAULT_REGION}",
        description = "AWS region of the bucket (default: $AWS_DEFAULT_REGION)")
    private String region;

    @Option(names = "--aws-access-key-id", defaultValue = "${env:AWS_ACCESS_KEY_ID}", hidden = true)
    private String accessKeyId;

    @Option(names = "--aws-secret-access-key", defaultValue = "${env:AWS_SECRET_ACCESS_KEY}", hidden = true)
    private String secretAccessKey;

    @Option(names = "--metrics",
        description = "Log counters of deleted rows, batches and dumps when the run ends")
    private boolean metrics;

    public static void main(final String[] args) {
        LoggingSetup.configure();
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new MaintenanceCommand());
        commandLine.setCommandName("dbmaint");
        return commandLine;
    }

    @Override
    public Integer call() {
        final MaintenanceRun config;
        try {
            config = ConfigLoader.load(configFile);
        } catch (ConfigurationException e) {
            logger.log(Level.SEVERE, "Failed to load configuration: {0}", e.getMessage());
            return 1;
        }

        ExecutionMode mode = ExecutionMode.of(dryRun);
        ConnectionParams params = new ConnectionParams(host, port, user != null ? user : "", password, dumpExecutable);
        SimpleMeterRegistry registry = metrics ? new SimpleMeterRegistry() : null;

        RunReport report;
        try (HikariDataSource dataSource = new HikariDataSource(hikariConfig());
             S3DumpUploader uploader = uploader(config);
             MicrometerMetricsExporter exporter = registry != null ? new MicrometerMetricsExporter(registry) : null) {
            report = RunCoordinator.builder()
                    .sessionProvider(new DataSourceSessionProvider(dataSource))
                    .mode(mode)
                    .connectionParams(params)
                    .uploader(uploader)
                    .metrics(exporter != null ? exporter : MetricsExporter.NOOP)
                    .build()
                    .run(config);
            if (registry != null) {
                logMeters(registry);
            }
        }

        logger.log(Level.INFO, "Processed {0} tables: {1} aborted, {2} with errors, {3} database groups skipped",
                new Object[]{report.tablesProcessed(), report.tablesAborted(), report.tablesWithErrors(),
                        report.groupsSkipped()});
        return report.completed() ? 0 : 1;
    }

    String jdbcUrl() {
        return jdbcUrl != null ? jdbcUrl : "jdbc:mysql://" + host + ":" + port + "/";
    }

    private HikariConfig hikariConfig() {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("dbmaint");
        hikari.setJdbcUrl(jdbcUrl());
        hikari.setUsername(user);
        hikari.setPassword(password);
        hikari.setMaximumPoolSize(1);
        hikari.setAutoCommit(false);
        hikari.setConnectionTimeout(10_000);
        // connection problems surface when the run opens its session
        hikari.setInitializationFailTimeout(-1);
        return hikari;
    }

    private S3DumpUploader uploader(MaintenanceRun config) {
        boolean remoteDumps = config.databases().stream()
                .flatMap(group -> group.tables().stream())
                .anyMatch(table -> table.dump().filter(d -> d.storage() == DumpStorage.S3).isPresent());
        if (!remoteDumps) {
            return null;
        }
        if (bucket == null || bucket.isBlank()) {
            logger.warning("Dumps are configured for S3 but no bucket is set; they will be kept locally");
            return null;
        }
        try {
            return S3DumpUploader.create(bucket, region, accessKeyId, secretAccessKey);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Object storage could not be configured; dumps will be kept locally", e);
            return null;
        }
    }

    private static void logMeters(SimpleMeterRegistry registry) {
        for (Meter meter : registry.getMeters()) {
            for (Measurement measurement : meter.measure()) {
                logger.log(Level.INFO, "Metric {0} {1}={2}", new Object[]{
                        meter.getId().getName(), measurement.getStatistic(), measurement.getValue()});
            }
        }
    }
}
