package io.dbmaint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only, ordered audit trail of a maintenance run.
 *
 * <p>One instance is created per run and passed to every component that reports outcomes.
 * Each entry is also forwarded to the diagnostic logger at the level it was appended with,
 * so the console and log file show progress while the run is still going.
 *
 * <p>Not thread-safe; runs are strictly sequential.
 */
public final class ResultLog {
    private static final Logger logger = Logger.getLogger(ResultLog.class.getName());

    private final List<String> entries = new ArrayList<>();

    public void info(String message) {
        append(Level.INFO, message);
    }

    public void warn(String message) {
        append(Level.WARNING, message);
    }

    public void error(String message) {
        append(Level.SEVERE, message);
    }

    private void append(Level level, String message) {
        entries.add(message);
        logger.log(level, message);
    }

    /**
     * Returns a read-only view of all entries in the order they were appended.
     */
    public List<String> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }
}
