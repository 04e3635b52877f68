/**
 * Micrometer integration: exports job counters, gauges and durations to a
 * {@link io.micrometer.core.instrument.MeterRegistry}.
 */
package netimport.micrometer;
