package telemetry.spring.boot;

import telemetry.EventConsumer;
import telemetry.Telemetry;
import telemetry.spi.MetricsExporter;
import telemetry.spi.Transport;
import telemetry.transport.LoggingTransport;
import telemetry.worker.EventFilter;
import telemetry.worker.WorkerConfig;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.logging.Logger;

/**
 * Auto-configuration for the telemetry pipeline.
 *
 * <p>Wires up a {@link Telemetry} composite from {@link TelemetryProperties} and the
 * {@link Transport} bean, falling back to a {@link LoggingTransport} when the application
 * defines none. {@link EventConsumer} beans are registered on the event bus next to the worker.
 *
 * @see TelemetryProperties
 * @see TelemetryMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Telemetry.class)
@EnableConfigurationProperties(TelemetryProperties.class)
public class TelemetryAutoConfiguration {
  private static final Logger logger = Logger.getLogger(TelemetryAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean(Transport.class)
  public LoggingTransport telemetryTransport() {
    logger.info("No telemetry Transport bean found; events will be written to the log");
    return new LoggingTransport();
  }

  @Bean
  @ConditionalOnMissingBean
  public WorkerConfig telemetryWorkerConfig(TelemetryProperties props) {
    TelemetryProperties.Worker worker = props.getWorker();
    return WorkerConfig.builder()
        .failureThreshold(worker.getFailureThreshold())
        .recoveryTimeout(worker.getRecoveryTimeout())
        .halfOpenMaxEvents(worker.getHalfOpenMaxEvents())
        .rateLimitWindow(worker.getRateLimitWindow())
        .rateLimitMaxEvents(worker.getRateLimitMaxEvents())
        .rateLimitScope(worker.getRateLimitScope())
        .samplingRate(worker.getSamplingRate())
        .slowThreshold(worker.getSlowThreshold())
        .batchingEnabled(worker.isBatchingEnabled())
        .batchSize(worker.getBatchSize())
        .batchTimeout(worker.getBatchTimeout())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Telemetry telemetry(TelemetryProperties props,
      WorkerConfig workerConfig,
      Transport transport,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<EventFilter> filterProvider,
      ObjectProvider<EventConsumer> consumerProvider) {

    var builder = Telemetry.builder()
        .transport(transport)
        .config(workerConfig)
        .enabled(props.isEnabled())
        .busWorkerCount(props.getBus().getWorkerCount())
        .busQueueCapacity(props.getBus().getQueueCapacity())
        .drainTimeout(props.getBus().getDrainTimeout())
        .deduplicationTtl(props.getBus().getDeduplicationTtl())
        .deduplicationMaxEntries(props.getBus().getDeduplicationMaxEntries())
        .flushTimeout(props.getFlushTimeout());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    EventFilter filter = filterProvider.getIfAvailable();
    if (filter != null) {
      builder.filter(filter);
    }

    Telemetry telemetry = builder.build();
    consumerProvider.orderedStream().forEach(consumer -> {
      if (!telemetry.register(consumer)) {
        telemetry.close();
        throw new IllegalStateException("Duplicate event consumer name: " + consumer.name());
      }
    });
    return telemetry;
  }
}
