package io.dbmaint.sql;

import io.dbmaint.MaintenanceException;

/**
 * Unchecked exception wrapping a driver-level error reported while executing a statement.
 *
 * <p>Callers decide whether the failure is fatal to the current step, table or group.
 */
public final class SqlExecutionException extends MaintenanceException {
    public SqlExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
