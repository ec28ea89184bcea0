/**
 * Built-in {@link io.dbmaint.jdbc.spi.Dialect} implementations and the
 * {@link io.dbmaint.jdbc.dialect.Dialects} registry.
 */
package io.dbmaint.jdbc.dialect;
