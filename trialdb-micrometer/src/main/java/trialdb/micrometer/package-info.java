/**
 * Micrometer integration for trialdb metrics.
 *
 * @see trialdb.micrometer.MicrometerMetricsExporter
 */
package trialdb.micrometer;
