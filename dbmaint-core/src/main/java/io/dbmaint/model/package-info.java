/**
 * Immutable maintenance configuration: {@link io.dbmaint.model.MaintenanceRun} →
 * {@link io.dbmaint.model.DatabaseGroup} → {@link io.dbmaint.model.TableSpec}.
 *
 * <p>Configuration is validated once when these records are built. Identifiers must be plain
 * names; step-level defects are represented as {@link io.dbmaint.model.DeleteStrategy.Invalid}
 * so that they are reported, not silently skipped.
 */
package io.dbmaint.model;
