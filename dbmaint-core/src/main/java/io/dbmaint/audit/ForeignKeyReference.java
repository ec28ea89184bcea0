package io.dbmaint.audit;

/**
 * One column of a table that references a column of another table.
 */
public record ForeignKeyReference(
        String constraintName,
        String table,
        String column,
        String referencedTable,
        String referencedColumn) {

    @Override
    public String toString() {
        return constraintName + ": " + table + "." + column + " -> " + referencedTable + "." + referencedColumn;
    }
}
