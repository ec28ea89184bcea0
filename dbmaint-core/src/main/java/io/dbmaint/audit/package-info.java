/**
 * Read-only foreign-key audit run before destructive steps.
 */
package io.dbmaint.audit;
