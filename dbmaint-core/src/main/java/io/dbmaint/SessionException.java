package io.dbmaint;

/**
 * Thrown when a database session cannot be opened. Fatal to the whole run.
 */
public final class SessionException extends MaintenanceException {
    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
