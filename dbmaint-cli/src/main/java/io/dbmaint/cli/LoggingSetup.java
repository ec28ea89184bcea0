package io.dbmaint.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Installs the bundled {@code java.util.logging} configuration: console plus
 * {@code maintenance.log} in the working directory.
 *
 * <p>An explicit {@code -Djava.util.logging.config.file} or {@code .class} always wins.
 */
final class LoggingSetup {
    private static final Logger logger = Logger.getLogger(LoggingSetup.class.getName());

    static final String RESOURCE = "/dbmaint-logging.properties";

    private LoggingSetup() {}

    static void configure() {
        configure(RESOURCE);
    }

    /**
     * @return {@code true} if {@code resource} was applied
     */
    static boolean configure(String resource) {
        if (System.getProperty("java.util.logging.config.file") != null
                || System.getProperty("java.util.logging.config.class") != null) {
            return false;
        }
        try (InputStream in = LoggingSetup.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.log(Level.WARNING, "Logging configuration {0} not found; using JVM defaults", resource);
                return false;
            }
            LogManager.getLogManager().readConfiguration(in);
            return true;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to apply logging configuration " + resource, e);
            return false;
        }
    }
}
