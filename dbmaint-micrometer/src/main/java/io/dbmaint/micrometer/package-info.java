/**
 * Micrometer integration: exports maintenance counters to any {@link io.micrometer.core.instrument.MeterRegistry}.
 *
 * @see io.dbmaint.micrometer.MicrometerMetricsExporter
 */
package io.dbmaint.micrometer;
