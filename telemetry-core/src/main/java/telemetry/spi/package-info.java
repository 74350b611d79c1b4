/**
 * Service provider interfaces implemented outside the core: the backend
 * {@link telemetry.spi.Transport} and the {@link telemetry.spi.MetricsExporter} hook.
 */
package telemetry.spi;
