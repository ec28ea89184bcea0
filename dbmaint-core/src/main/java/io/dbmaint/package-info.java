/**
 * Root API for dbmaint, a configuration-driven maintenance engine for relational tables.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain io.dbmaint.model.MaintenanceRun run} lists database groups and, per group, the
 * tables to maintain. For each table the {@linkplain io.dbmaint.run.TableProcessor processor}
 * runs up to four steps in fixed order: a compressed {@linkplain io.dbmaint.dump.BackupGate dump},
 * an advisory {@linkplain io.dbmaint.audit.ForeignKeyAuditor foreign-key audit}, a
 * {@linkplain io.dbmaint.delete.BatchedDeletionEngine delete} and an optimize. A failed dump
 * stops the table before anything destructive runs.
 *
 * <p>Every outcome is appended to the run's {@link io.dbmaint.ResultLog}. In
 * {@linkplain io.dbmaint.ExecutionMode#DRY_RUN dry-run} every mutating statement and subprocess is
 * logged instead of executed; the result log still gets one entry per step.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>dbmaint-core</b>: model, steps, coordinator, SPI (zero external deps)</li>
 *   <li><b>dbmaint-jdbc</b>: JDBC session and SQL dialects (MySQL, H2)</li>
 *   <li><b>dbmaint-s3</b>: S3 upload of dumps</li>
 *   <li><b>dbmaint-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>dbmaint-cli</b>: command line and YAML configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * RunReport report = RunCoordinator.builder()
 *     .sessionProvider(new DataSourceSessionProvider(dataSource))
 *     .connectionParams(new ConnectionParams(host, 3306, user, password, null))
 *     .mode(ExecutionMode.DRY_RUN)
 *     .build()
 *     .run(config);
 * }</pre>
 */
package io.dbmaint;
