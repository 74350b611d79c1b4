package telemetry.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import telemetry.micrometer.MicrometerMetricsExporter;
import telemetry.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code telemetry.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link TelemetryAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the Telemetry composite.
 */
@AutoConfiguration(before = TelemetryAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "telemetry.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(TelemetryProperties.class)
public class TelemetryMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, TelemetryProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
