/**
 * Micrometer bridge for exporting telemetry pipeline metrics to Prometheus, Grafana, and other
 * backends.
 *
 * <p>{@link telemetry.micrometer.MicrometerMetricsExporter} implements the
 * {@link telemetry.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see telemetry.micrometer.MicrometerMetricsExporter
 */
package telemetry.micrometer;
