package telemetry;

import telemetry.bus.AsyncEventBus;
import telemetry.spi.MetricsExporter;
import telemetry.spi.Transport;
import telemetry.worker.EventFilter;
import telemetry.worker.TelemetryWorker;
import telemetry.worker.WorkerConfig;
import telemetry.worker.WorkerStats;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link TelemetryWorker} to an {@link AsyncEventBus} as a
 * single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Telemetry telemetry = Telemetry.builder()
 *     .transport(backendTransport)
 *     .config(WorkerConfig.builder().samplingRate(0.5).build())
 *     .build()) {
 *   telemetry.report(exception, "datastore");
 * }
 * }</pre>
 *
 * <p>{@link #report} and {@link #publish} never block and never throw for a full queue; they
 * return {@code false} instead.
 *
 * @see TelemetryWorker
 * @see AsyncEventBus
 */
public final class Telemetry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Telemetry.class.getName());

  private final TelemetryWorker worker;
  private final AsyncEventBus bus;
  private final MetricsExporter metrics;
  private final Duration flushTimeout;

  private Telemetry(TelemetryWorker worker, AsyncEventBus bus, MetricsExporter metrics,
      Duration flushTimeout) {
    this.worker = worker;
    this.bus = bus;
    this.metrics = metrics;
    this.flushTimeout = flushTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reports a throwable raised by {@code component}. Component, category and context are taken
   * from the throwable's capabilities when it has them.
   *
   * @param error     the error
   * @param component the component to use when the error does not name one
   * @return {@code true} if the event was queued
   * @see ErrorEvents#from(Throwable, String)
   */
  public boolean report(Throwable error, String component) {
    return publish(ErrorEvents.from(error, component));
  }

  public boolean report(Throwable error) {
    return publish(ErrorEvents.from(error));
  }

  /**
   * Queues an event for asynchronous processing.
   *
   * @return {@code true} if the event was queued
   */
  public boolean publish(ErrorEvent event) {
    return bus.publish(event);
  }

  /**
   * Registers an additional consumer on the bus, next to the worker.
   *
   * @return {@code false} if the name is taken or the bus is closed
   */
  public boolean register(EventConsumer consumer) {
    return bus.register(consumer);
  }

  public void setEnabled(boolean enabled) {
    worker.setEnabled(enabled);
  }

  public boolean isEnabled() {
    return worker.isEnabled();
  }

  public WorkerStats stats() {
    return worker.stats();
  }

  public TelemetryWorker worker() {
    return worker;
  }

  public AsyncEventBus bus() {
    return bus;
  }

  /**
   * Stops the bus, draining queued events, then flushes the transport. A metrics exporter that
   * is {@link AutoCloseable} is closed last.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      bus.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      if (!worker.flush(flushTimeout)) {
        logger.warning("Transport did not flush within " + flushTimeout);
      }
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Telemetry}. */
  public static final class Builder {
    private Transport transport;
    private WorkerConfig config;
    private MetricsExporter metrics;
    private Clock clock;
    private EventFilter filter;
    private boolean enabled = true;
    private int busWorkerCount = 2;
    private int busQueueCapacity = 1000;
    private Duration drainTimeout = Duration.ofSeconds(5);
    private Duration flushTimeout = Duration.ofSeconds(2);
    private Duration deduplicationTtl = AsyncEventBus.DEFAULT_DEDUPLICATION_TTL;
    private int deduplicationMaxEntries = AsyncEventBus.DEFAULT_DEDUPLICATION_MAX_ENTRIES;
    private boolean built;

    private Builder() {}

    /**
     * Sets the backend client.
     *
     * <p><b>Required.</b>
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Optional. Defaults to {@link WorkerConfig#defaults()}.
     */
    public Builder config(WorkerConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the metrics exporter shared by the worker and the bus.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the time source of the worker gates and the bus deduplication window.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@link telemetry.worker.OperationalErrorFilter#INSTANCE}.
     */
    public Builder filter(EventFilter filter) {
      this.filter = filter;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}.
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Optional. Defaults to {@code 2}. Must be &ge; 1.
     */
    public Builder busWorkerCount(int busWorkerCount) {
      this.busWorkerCount = busWorkerCount;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000}. Must be &gt; 0.
     */
    public Builder busQueueCapacity(int busQueueCapacity) {
      this.busQueueCapacity = busQueueCapacity;
      return this;
    }

    /**
     * Sets how long {@link Telemetry#close()} waits for queued events.
     *
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets how long a published event suppresses identical events.
     *
     * <p>Optional. Defaults to 5 minutes. {@link Duration#ZERO} disables deduplication.
     */
    public Builder deduplicationTtl(Duration deduplicationTtl) {
      this.deduplicationTtl = deduplicationTtl;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000}. Must be &ge; 1.
     */
    public Builder deduplicationMaxEntries(int deduplicationMaxEntries) {
      this.deduplicationMaxEntries = deduplicationMaxEntries;
      return this;
    }

    /**
     * Sets how long {@link Telemetry#close()} waits for the transport to flush.
     *
     * <p>Optional. Defaults to 2 seconds.
     */
    public Builder flushTimeout(Duration flushTimeout) {
      this.flushTimeout = flushTimeout;
      return this;
    }

    /**
     * Builds the worker, starts the bus and registers the worker on it.
     *
     * @return a new {@link Telemetry}
     * @throws NullPointerException if {@code transport} is null
     * @throws IllegalStateException if this builder was already used
     */
    public Telemetry build() {
      if (built) {
        throw new IllegalStateException("Builder already used");
      }
      Objects.requireNonNull(transport, "transport");
      Objects.requireNonNull(flushTimeout, "flushTimeout");
      WorkerConfig workerConfig = config != null ? config : WorkerConfig.defaults();
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;

      TelemetryWorker worker = TelemetryWorker.builder()
          .config(workerConfig)
          .transport(transport)
          .metrics(exporter)
          .clock(clock)
          .filter(filter)
          .enabled(enabled)
          .build();
      AsyncEventBus bus = AsyncEventBus.builder()
          .workerCount(busWorkerCount)
          .queueCapacity(busQueueCapacity)
          .batchSize(workerConfig.batchSize())
          .batchTimeout(workerConfig.batchTimeout())
          .drainTimeout(drainTimeout)
          .deduplicationTtl(deduplicationTtl)
          .deduplicationMaxEntries(deduplicationMaxEntries)
          .clock(clock)
          .metrics(exporter)
          .build();
      try {
        if (!bus.register(worker)) {
          throw new IllegalStateException("Failed to register " + worker.name());
        }
      } catch (RuntimeException e) {
        bus.close();
        throw e;
      }
      built = true;
      logger.log(Level.INFO, "Telemetry started: " + workerConfig);
      return new Telemetry(worker, bus, exporter, flushTimeout);
    }
  }
}
