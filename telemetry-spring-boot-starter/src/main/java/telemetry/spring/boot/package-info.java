/**
 * Spring Boot auto-configuration for the telemetry pipeline.
 *
 * <p>Add the starter and, optionally, a {@link telemetry.spi.Transport} bean for the backend.
 * Everything else is configured under the {@code telemetry.*} properties.
 *
 * @see telemetry.spring.boot.TelemetryAutoConfiguration
 * @see telemetry.spring.boot.TelemetryProperties
 */
package telemetry.spring.boot;
