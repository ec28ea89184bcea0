package io.dbmaint.spi;

import io.dbmaint.SessionException;

/**
 * Opens the single database session used for a whole maintenance run.
 *
 * <p>Implemented by {@code io.dbmaint.jdbc.DataSourceSessionProvider}.
 */
@FunctionalInterface
public interface SessionProvider {

    /**
     * Opens a new session; the caller must close it.
     *
     * @throws SessionException if no connection can be established
     */
    SqlSession openSession();
}
