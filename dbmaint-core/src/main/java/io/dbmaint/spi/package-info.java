/**
 * Service Provider Interfaces (SPI) at the boundaries of a maintenance run.
 *
 * <p>The core never talks to a driver, a subprocess or a storage client directly; it goes through
 * these interfaces so that dry-run behavior and failure handling can be verified in isolation.
 *
 * @see io.dbmaint.spi.SqlSession
 * @see io.dbmaint.spi.SqlDialect
 * @see io.dbmaint.spi.SessionProvider
 * @see io.dbmaint.spi.DumpUploader
 * @see io.dbmaint.spi.MetricsExporter
 */
package io.dbmaint.spi;
