/**
 * Pre-delete table dumps: invocation of the dump utility, compression, optional upload.
 *
 * <p>Credentials passed to the utility never appear in log output; use
 * {@link io.dbmaint.dump.DumpCommand#masked()} for anything human-readable.
 */
package io.dbmaint.dump;
