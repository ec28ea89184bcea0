package io.dbmaint.model;

import java.util.List;

/**
 * Immutable configuration of one maintenance invocation: database groups in processing order.
 */
public record MaintenanceRun(List<DatabaseGroup> databases) {
    public MaintenanceRun {
        databases = databases != null ? List.copyOf(databases) : List.of();
    }

    public int tableCount() {
        return databases.stream().mapToInt(g -> g.tables().size()).sum();
    }
}
