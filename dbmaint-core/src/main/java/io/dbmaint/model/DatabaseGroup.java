package io.dbmaint.model;

import io.dbmaint.sql.Identifiers;

import java.util.List;

/**
 * A database and the tables maintained in it, in processing order.
 */
public record DatabaseGroup(String database, List<TableSpec> tables) {
    public DatabaseGroup {
        Identifiers.validate(database);
        tables = tables != null ? List.copyOf(tables) : List.of();
    }
}
