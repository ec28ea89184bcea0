/**
 * Per-table step ordering and the run-level coordinator.
 *
 * @see io.dbmaint.run.RunCoordinator
 */
package io.dbmaint.run;
