/**
 * JDBC implementation of the session SPI.
 *
 * <p>{@link io.dbmaint.jdbc.JdbcSqlSession} runs statements over a single connection.
 * {@link io.dbmaint.jdbc.DataSourceSessionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.dbmaint.spi.SessionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.dbmaint.jdbc.spi}: the JDBC dialect SPI</li>
 *   <li>{@code io.dbmaint.jdbc.dialect}: built-in dialects and the dialect registry</li>
 * </ul>
 *
 * @see io.dbmaint.jdbc.JdbcTemplate
 */
package io.dbmaint.jdbc;
