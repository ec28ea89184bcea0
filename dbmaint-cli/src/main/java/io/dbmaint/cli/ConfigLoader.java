package io.dbmaint.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.dbmaint.ConfigurationException;
import io.dbmaint.model.BatchSettings;
import io.dbmaint.model.DatabaseGroup;
import io.dbmaint.model.DeleteStrategy;
import io.dbmaint.model.DumpRequest;
import io.dbmaint.model.DumpStorage;
import io.dbmaint.model.MaintenanceRun;
import io.dbmaint.model.TableSpec;
import io.dbmaint.sql.Identifiers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the YAML maintenance configuration into a {@link MaintenanceRun}.
 *
 * <p>Structural problems (unreadable file, malformed YAML, missing or invalid names, unknown dump
 * storage) fail the load with {@link ConfigurationException}. Problems confined to one table's
 * delete step become {@link DeleteStrategy.Invalid} and are reported when that table is processed.
 * Unknown keys are ignored.
 */
public final class ConfigLoader {
    private static final Logger logger = Logger.getLogger(ConfigLoader.class.getName());

    public static final String DEFAULT_CONFIG_FILE = "maintenance_config.yml";

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigLoader() {}

    public static MaintenanceRun load(Path file) {
        logger.log(Level.INFO, "Loading configuration from {0}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Configuration file not found: " + file, e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    static MaintenanceRun parse(InputStream in) throws IOException {
        ConfigDocument document;
        try (JsonParser parser = MAPPER.createParser(in)) {
            document = parser.nextToken() != null ? MAPPER.readValue(parser, ConfigDocument.class) : null;
        } catch (JacksonException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.databases() == null || document.databases().isEmpty()) {
            logger.warning("Configuration lists no databases");
            return new MaintenanceRun(List.of());
        }
        List<DatabaseGroup> groups = new ArrayList<>();
        for (DatabaseEntry entry : document.databases()) {
            groups.add(toGroup(entry));
        }
        MaintenanceRun run = new MaintenanceRun(groups);
        logger.log(Level.INFO, "Loaded {0} database groups with {1} tables",
                new Object[]{groups.size(), run.tableCount()});
        return run;
    }

    private static DatabaseGroup toGroup(DatabaseEntry entry) {
        String database = requireName(entry.name(), "database");
        List<TableSpec> tables = new ArrayList<>();
        if (entry.tables() != null) {
            for (TableEntry table : entry.tables()) {
                tables.add(toTableSpec(database, table));
            }
        }
        return new DatabaseGroup(database, tables);
    }

    private static TableSpec toTableSpec(String database, TableEntry entry) {
        if (entry == null) {
            throw new ConfigurationException("Empty table entry in database `" + database + "`");
        }
        String table = requireName(entry.name(), "table in database `" + database + "`");
        TableSpec.Builder builder = TableSpec.builder(table)
                .checkForeignKeys(Boolean.TRUE.equals(entry.checkForeignKeys()))
                .runOptimize(Boolean.TRUE.equals(entry.runOptimize()))
                .deleteStrategy(deleteStrategy(table, entry));
        if (Boolean.TRUE.equals(entry.dumpBefore())) {
            builder.dump(new DumpRequest(storage(table, entry.dumpStorage()),
                    entry.dumpPath() != null ? Path.of(entry.dumpPath()) : null));
        }
        return builder.build();
    }

    private static DeleteStrategy deleteStrategy(String table, TableEntry entry) {
        String name = entry.deleteStrategy();
        if (name == null || name.isBlank()) {
            return DeleteStrategy.NONE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "truncate":
                return DeleteStrategy.TRUNCATE;
            case "condition": {
                if (entry.deleteCondition() == null || entry.deleteCondition().isBlank()) {
                    return new DeleteStrategy.Invalid(
                            "No delete_condition provided for `" + table + "` with condition strategy.");
                }
                String defect = batchingDefect(table, entry);
                if (defect != null) {
                    return new DeleteStrategy.Invalid(defect);
                }
                return new DeleteStrategy.Condition(entry.deleteCondition(), batching(entry));
            }
            case "older_than_days":
            case "older_than": {
                Integer days = entry.deleteOlderThanDays();
                if (days == null || days < 0) {
                    return new DeleteStrategy.Invalid("No valid delete_older_than_days provided for `" + table
                            + "` with older_than_days strategy.");
                }
                String defect = batchingDefect(table, entry);
                if (defect != null) {
                    return new DeleteStrategy.Invalid(defect);
                }
                String column = entry.dateColumn() != null ? entry.dateColumn() : DeleteStrategy.DEFAULT_DATE_COLUMN;
                return new DeleteStrategy.OlderThan(days, requireName(column, "date_column of `" + table + "`"),
                        batching(entry));
            }
            default:
                return new DeleteStrategy.Invalid("Unknown delete_strategy `" + name + "` for `" + table + "`.");
        }
    }

    private static String batchingDefect(String table, TableEntry entry) {
        if (entry.deleteBatchSize() != null && entry.deleteBatchSize() < 0) {
            return "Invalid delete_batch_size " + entry.deleteBatchSize() + " for `" + table + "`.";
        }
        if (entry.deleteBatchDelay() != null && (entry.deleteBatchDelay() < 0 || entry.deleteBatchDelay().isNaN())) {
            return "Invalid delete_batch_delay " + entry.deleteBatchDelay() + " for `" + table + "`.";
        }
        return null;
    }

    private static BatchSettings batching(TableEntry entry) {
        int size = entry.deleteBatchSize() != null ? entry.deleteBatchSize() : 0;
        Duration delay = entry.deleteBatchDelay() != null
                ? Duration.ofMillis(Math.round(entry.deleteBatchDelay() * 1000))
                : Duration.ZERO;
        return BatchSettings.of(size, delay);
    }

    private static DumpStorage storage(String table, String value) {
        try {
            return DumpStorage.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage() + " for `" + table + "`");
        }
    }

    private static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Missing name for " + what);
        }
        try {
            return Identifiers.validate(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid name for " + what + ": " + name);
        }
    }

    record ConfigDocument(@JsonProperty("databases") List<DatabaseEntry> databases) {
    }

    record DatabaseEntry(
            @JsonProperty("name") String name,
            @JsonProperty("tables") List<TableEntry> tables) {
    }

    record TableEntry(
            @JsonProperty("name") String name,
            @JsonProperty("dump_before") Boolean dumpBefore,
            @JsonProperty("dump_storage") String dumpStorage,
            @JsonProperty("dump_path") String dumpPath,
            @JsonProperty("check_foreign_keys") Boolean checkForeignKeys,
            @JsonProperty("delete_strategy") String deleteStrategy,
            @JsonProperty("delete_condition") String deleteCondition,
            @JsonProperty("delete_older_than_days") Integer deleteOlderThanDays,
            @JsonProperty("date_column") String dateColumn,
            @JsonProperty("delete_batch_size") Integer deleteBatchSize,
            @JsonProperty("delete_batch_delay") Double deleteBatchDelay,
            @JsonProperty("run_optimize") Boolean runOptimize) {
    }
}
