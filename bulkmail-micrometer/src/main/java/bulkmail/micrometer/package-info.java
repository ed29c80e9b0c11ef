/**
 * Micrometer bridge for exporting bulkmail pipeline metrics.
 *
 * @see bulkmail.micrometer.MicrometerMetricsExporter
 */
package bulkmail.micrometer;
