package io.dbmaint;

/**
 * Thrown when a maintenance configuration cannot be loaded or is structurally invalid
 * (unreadable document, missing names, invalid identifiers).
 *
 * <p>Table-level defects that only affect one step (e.g. a {@code condition} strategy without a
 * predicate) are not reported through this exception; they are carried as
 * {@link io.dbmaint.model.DeleteStrategy.Invalid} and reported when the table is processed.
 */
public final class ConfigurationException extends MaintenanceException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
