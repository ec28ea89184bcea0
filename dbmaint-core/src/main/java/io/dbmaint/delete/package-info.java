/**
 * Delete step: truncate, unbounded delete, or batched delete with pacing.
 */
package io.dbmaint.delete;
