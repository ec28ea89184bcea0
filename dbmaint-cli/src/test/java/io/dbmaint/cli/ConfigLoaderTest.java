package io.dbmaint.cli;

import io.dbmaint.ConfigurationException;
import io.dbmaint.model.DatabaseGroup;
import io.dbmaint.model.DeleteStrategy;
import io.dbmaint.model.DumpStorage;
import io.dbmaint.model.MaintenanceRun;
import io.dbmaint.model.TableSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    private static MaintenanceRun parse(String yaml) throws IOException {
        return ConfigLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    private static TableSpec onlyTable(String tableYaml) throws IOException {
        MaintenanceRun run = parse("databases:\n  - name: shop\n    tables:\n" + tableYaml);
        return run.databases().get(0).tables().get(0);
    }

    @Test
    void fullDocumentKeepsOrderAndOptions() throws IOException {
        MaintenanceRun run = parse(String.join("\n",
                "databases:",
                "  - name: shop",
                "    tables:",
                "      - name: orders",
                "        dump_before: true",
                "        dump_storage: s3",
                "        dump_path: /var/tmp/dumps",
                "        check_foreign_keys: true",
                "        delete_strategy: older_than_days",
                "        delete_older_than_days: 30",
                "        date_column: created_at",
                "        delete_batch_size: 500",
                "        delete_batch_delay: 1.5",
                "        run_optimize: true",
                "      - name: sessions",
                "        delete_strategy: truncate",
                "  - name: reporting",
                "    tables:",
                "      - name: jobs",
                "        delete_strategy: condition",
                "        delete_condition: \"status = 'done'\"",
                ""));

        assertEquals(2, run.databases().size());
        assertEquals(3, run.tableCount());
        DatabaseGroup shop = run.databases().get(0);
        assertEquals("shop", shop.database());
        assertEquals("orders", shop.tables().get(0).name());
        assertEquals("sessions", shop.tables().get(1).name());

        TableSpec orders = shop.tables().get(0);
        assertTrue(orders.checkForeignKeys());
        assertTrue(orders.runOptimize());
        assertEquals(DumpStorage.S3, orders.dump().orElseThrow().storage());
        assertEquals(Path.of("/var/tmp/dumps"), orders.dump().orElseThrow().directory());
        DeleteStrategy.OlderThan olderThan = assertInstanceOf(DeleteStrategy.OlderThan.class, orders.deleteStrategy());
        assertEquals(30, olderThan.days());
        assertEquals("created_at", olderThan.dateColumn());
        assertEquals(500, olderThan.batching().size());
        assertEquals(Duration.ofMillis(1500), olderThan.batching().delay());

        assertInstanceOf(DeleteStrategy.Truncate.class, shop.tables().get(1).deleteStrategy());
        DeleteStrategy.Condition condition = assertInstanceOf(DeleteStrategy.Condition.class,
                run.databases().get(1).tables().get(0).deleteStrategy());
        assertEquals("status = 'done'", condition.predicate());
        assertFalse(condition.batching().isBounded());
    }

    @Test
    void defaultsAreOff() throws IOException {
        TableSpec table = onlyTable("      - name: orders\n");
        assertTrue(table.dump().isEmpty());
        assertFalse(table.checkForeignKeys());
        assertFalse(table.runOptimize());
        assertInstanceOf(DeleteStrategy.None.class, table.deleteStrategy());
    }

    @Test
    void dumpDefaultsToLocalWorkingDirectory() throws IOException {
        TableSpec table = onlyTable("      - name: orders\n        dump_before: true\n");
        assertEquals(DumpStorage.LOCAL, table.dump().orElseThrow().storage());
        assertEquals(Path.of("."), table.dump().orElseThrow().directory());
    }

    @Test
    void strategyNamesAreCaseInsensitive() throws IOException {
        assertInstanceOf(DeleteStrategy.Truncate.class,
                onlyTable("      - name: t\n        delete_strategy: TRUNCATE\n").deleteStrategy());
        DeleteStrategy.OlderThan olderThan = assertInstanceOf(DeleteStrategy.OlderThan.class,
                onlyTable("      - name: t\n        delete_strategy: Older_Than\n        delete_older_than_days: 7\n")
                        .deleteStrategy());
        assertEquals("date", olderThan.dateColumn());
    }

    @Test
    void conditionWithoutPredicateIsInvalid() throws IOException {
        DeleteStrategy.Invalid invalid = assertInstanceOf(DeleteStrategy.Invalid.class,
                onlyTable("      - name: jobs\n        delete_strategy: condition\n").deleteStrategy());
        assertEquals("No delete_condition provided for `jobs` with condition strategy.", invalid.reason());
    }

    @Test
    void olderThanWithoutDaysOrWithNegativeDaysIsInvalid() throws IOException {
        DeleteStrategy.Invalid missing = assertInstanceOf(DeleteStrategy.Invalid.class,
                onlyTable("      - name: logs\n        delete_strategy: older_than_days\n").deleteStrategy());
        assertEquals("No valid delete_older_than_days provided for `logs` with older_than_days strategy.",
                missing.reason());
        assertInstanceOf(DeleteStrategy.Invalid.class, onlyTable(
                "      - name: logs\n        delete_strategy: older_than_days\n        delete_older_than_days: -1\n")
                .deleteStrategy());
    }

    @Test
    void zeroDaysDeletesEverythingBeforeToday() throws IOException {
        DeleteStrategy.OlderThan olderThan = assertInstanceOf(DeleteStrategy.OlderThan.class, onlyTable(
                "      - name: logs\n        delete_strategy: older_than_days\n        delete_older_than_days: 0\n")
                .deleteStrategy());
        assertEquals(0, olderThan.days());
    }

    @Test
    void unknownStrategyIsInvalid() throws IOException {
        DeleteStrategy.Invalid invalid = assertInstanceOf(DeleteStrategy.Invalid.class,
                onlyTable("      - name: logs\n        delete_strategy: archive\n").deleteStrategy());
        assertEquals("Unknown delete_strategy `archive` for `logs`.", invalid.reason());
    }

    @Test
    void negativeBatchSettingsAreInvalid() throws IOException {
        DeleteStrategy.Invalid size = assertInstanceOf(DeleteStrategy.Invalid.class, onlyTable(
                "      - name: logs\n        delete_strategy: condition\n        delete_condition: id > 1\n"
                        + "        delete_batch_size: -5\n").deleteStrategy());
        assertEquals("Invalid delete_batch_size -5 for `logs`.", size.reason());
        assertInstanceOf(DeleteStrategy.Invalid.class, onlyTable(
                "      - name: logs\n        delete_strategy: condition\n        delete_condition: id > 1\n"
                        + "        delete_batch_delay: -1\n").deleteStrategy());
    }

    @Test
    void unknownKeysAreIgnored() throws IOException {
        TableSpec table = onlyTable("      - name: orders\n        retention_owner: finance\n");
        assertEquals("orders", table.name());
    }

    @Test
    void emptyDocumentYieldsEmptyRun() throws IOException {
        assertEquals(0, parse("").tableCount());
        assertEquals(0, parse("databases: []\n").tableCount());
    }

    @Test
    void structuralProblemsFailTheLoad() {
        assertThrows(ConfigurationException.class, () -> parse("databases:\n  - tables: []\n"));
        assertThrows(ConfigurationException.class,
                () -> parse("databases:\n  - name: shop\n    tables:\n      - name: \"orders; DROP\"\n"));
        assertThrows(ConfigurationException.class,
                () -> parse("databases:\n  - name: shop\n    tables:\n      - name: t\n"
                        + "        dump_before: true\n        dump_storage: ftp\n"));
        assertThrows(ConfigurationException.class, () -> parse("databases: [unclosed\n"));
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load(dir.resolve("absent.yml")));
        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.yml");
        Files.writeString(file, "databases:\n  - name: shop\n    tables:\n      - name: orders\n");
        assertEquals(1, ConfigLoader.load(file).tableCount());
    }

    @Test
    void bundledExampleParses() throws IOException {
        try (var in = ConfigLoaderTest.class.getResourceAsStream("/maintenance_config.example.yml")) {
            MaintenanceRun run = ConfigLoader.parse(in);
            assertEquals(3, run.tableCount());
            run.databases().forEach(group -> group.tables().forEach(table ->
                    assertFalse(table.deleteStrategy() instanceof DeleteStrategy.Invalid, table.name())));
        }
    }
}
