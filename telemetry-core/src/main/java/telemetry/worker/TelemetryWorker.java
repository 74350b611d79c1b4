package telemetry.worker;

import telemetry.ErrorCategory;
import telemetry.ErrorEvent;
import telemetry.EventConsumer;
import telemetry.TransportException;
import telemetry.gate.CircuitBreaker;
import telemetry.gate.CircuitState;
import telemetry.gate.DeterministicSampler;
import telemetry.gate.RateLimiter;
import telemetry.gate.Sampler;
import telemetry.gate.SlidingWindowRateLimiter;
import telemetry.privacy.PrivacyScrubber;
import telemetry.spi.MetricsExporter;
import telemetry.spi.Transport;
import telemetry.transport.TransportEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event consumer that gates, scrubs and forwards error events to a {@link Transport}.
 *
 * <p>{@link #processEvent(ErrorEvent)} runs a fixed pipeline and stops at the first rejection:
 * <ol>
 *   <li>reporting disabled: dropped ({@link DropReason#DISABLED})</li>
 *   <li>circuit breaker denies: dropped ({@link DropReason#CIRCUIT_OPEN})</li>
 *   <li>rate limiter denies: dropped ({@link DropReason#RATE_LIMITED})</li>
 *   <li>sampler denies: dropped ({@link DropReason#UNSAMPLED})</li>
 *   <li>event already reported: ignored, no counter changes</li>
 *   <li>{@link EventFilter} rejects: marked reported, dropped ({@link DropReason#FILTERED})</li>
 *   <li>message and string context values scrubbed, event sent and timed</li>
 * </ol>
 *
 * <p>A transport failure counts as {@code failed} and as a breaker failure, and is rethrown for
 * the event bus to log. A successful send slower than {@link WorkerConfig#slowThreshold()} still
 * counts as processed but is reported to the breaker as a failure, so a backend that hangs
 * without erroring is isolated too. No rejection path throws.
 *
 * <p>Each worker owns its breaker, rate limiter, and counters. None of them is guarded by a
 * pipeline-wide lock, so concurrent calls only contend inside a single gate.
 *
 * @see WorkerConfig
 * @see telemetry.bus.AsyncEventBus
 */
public final class TelemetryWorker implements EventConsumer {
  private static final Logger logger = Logger.getLogger(TelemetryWorker.class.getName());

  public static final String DEFAULT_NAME = "telemetry-worker";

  private final String name;
  private final WorkerConfig config;
  private final Transport transport;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final CircuitBreaker circuitBreaker;
  private final RateLimiter rateLimiter;
  private final Sampler sampler;
  private final EventFilter filter;
  private final long slowThresholdMs;
  private final AtomicBoolean enabled;

  private final LongAdder processed = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final LongAdder slowDeliveries = new LongAdder();
  private final Map<DropReason, LongAdder> dropped = new EnumMap<>(DropReason.class);

  private TelemetryWorker(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.config = builder.config != null ? builder.config : WorkerConfig.defaults();
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.sampler = builder.sampler != null ? builder.sampler : DeterministicSampler.INSTANCE;
    this.filter = builder.filter != null ? builder.filter : OperationalErrorFilter.INSTANCE;
    this.rateLimiter = builder.rateLimiter != null
        ? builder.rateLimiter
        : new SlidingWindowRateLimiter(config.rateLimitWindow(), config.rateLimitMaxEvents(),
            SlidingWindowRateLimiter.DEFAULT_MAX_KEYS, clock);
    this.circuitBreaker = new CircuitBreaker(config.failureThreshold(), config.recoveryTimeout(),
        config.halfOpenMaxEvents(), clock, metrics::recordCircuitState);
    this.slowThresholdMs = config.slowThreshold().toMillis();
    this.enabled = new AtomicBoolean(builder.enabled);

    for (DropReason reason : DropReason.values()) {
      dropped.put(reason, new LongAdder());
    }
    metrics.recordCircuitState(CircuitState.CLOSED);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void processEvent(ErrorEvent event) throws TransportException {
    Objects.requireNonNull(event, "event");
    if (!enabled.get()) {
      drop(event, DropReason.DISABLED);
      return;
    }
    if (!circuitBreaker.allow()) {
      drop(event, DropReason.CIRCUIT_OPEN);
      return;
    }
    if (!rateLimiter.allow(config.rateLimitScope().keyFor(event.component()))) {
      drop(event, DropReason.RATE_LIMITED);
      return;
    }
    if (!sampler.shouldSample(event.component(), event.category(), config.samplingRate())) {
      drop(event, DropReason.UNSAMPLED);
      return;
    }
    if (event.isReported()) {
      return;
    }
    if (!filter.shouldReport(event)) {
      event.markReported();
      drop(event, DropReason.FILTERED);
      return;
    }

    TransportEvent outbound = toTransportEvent(event);
    long startMs = clock.millis();
    try {
      transport.send(outbound);
    } catch (TransportException e) {
      recordFailure(event, e);
      throw e;
    } catch (RuntimeException e) {
      recordFailure(event, e);
      throw new TransportException("Transport failed for event " + event.eventId(), e);
    }
    long elapsedMs = Math.max(0L, clock.millis() - startMs);
    metrics.recordTransportLatencyMs(elapsedMs);

    if (elapsedMs > slowThresholdMs) {
      circuitBreaker.recordFailure();
      slowDeliveries.increment();
      metrics.incrementSlowDelivery();
      logger.log(Level.WARNING, "Slow delivery of event " + event.eventId() + ": " + elapsedMs
          + "ms (threshold " + slowThresholdMs + "ms)");
    } else {
      circuitBreaker.recordSuccess();
    }
    processed.increment();
    metrics.incrementProcessed();
    event.markReported();
  }

  @Override
  public boolean supportsBatching() {
    return config.batchingEnabled();
  }

  /**
   * Switches reporting on or off. Takes effect for the next event on any thread.
   */
  public void setEnabled(boolean enabled) {
    boolean previous = this.enabled.getAndSet(enabled);
    if (previous != enabled) {
      logger.info("Telemetry reporting " + (enabled ? "enabled" : "disabled") + " for " + name);
    }
  }

  public boolean isEnabled() {
    return enabled.get();
  }

  /**
   * Returns a snapshot of the counters and the current breaker state.
   */
  public WorkerStats stats() {
    Map<DropReason, Long> byReason = new EnumMap<>(DropReason.class);
    long droppedTotal = 0;
    for (Map.Entry<DropReason, LongAdder> entry : dropped.entrySet()) {
      long count = entry.getValue().sum();
      byReason.put(entry.getKey(), count);
      droppedTotal += count;
    }
    return new WorkerStats(processed.sum(), droppedTotal, failed.sum(), slowDeliveries.sum(),
        circuitBreaker.state().wireName(), byReason);
  }

  public CircuitState circuitState() {
    return circuitBreaker.state();
  }

  public WorkerConfig config() {
    return config;
  }

  /**
   * Waits for the transport to deliver buffered events.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the transport flushed in time
   */
  public boolean flush(Duration timeout) {
    return transport.flush(timeout);
  }

  private void drop(ErrorEvent event, DropReason reason) {
    dropped.get(reason).increment();
    metrics.incrementDropped(reason);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Dropped event " + event.eventId() + " from " + event.component() + ": " + reason);
    }
  }

  private void recordFailure(ErrorEvent event, Exception failure) {
    failed.increment();
    metrics.incrementFailed();
    circuitBreaker.recordFailure();
    // backend messages may echo event text, so only the type is logged
    logger.log(Level.WARNING, "Failed to deliver event " + event.eventId() + " from "
        + event.component() + ": " + failure.getClass().getName());
  }

  private TransportEvent toTransportEvent(ErrorEvent event) {
    String title = EventTitles.titleOf(event);
    String message = PrivacyScrubber.scrubMessage("[" + event.category() + "] " + event.message());

    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("component", event.component());
    tags.put("category", event.category());
    tags.put("error_type", event.errorType());
    tags.put("error_title", title);

    Map<String, Object> contexts = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : event.context().entrySet()) {
      Object value = entry.getValue();
      contexts.put(entry.getKey(), value instanceof String text ? PrivacyScrubber.scrubMessage(text) : value);
    }

    return new TransportEvent(
        event.eventId(),
        title,
        message,
        ErrorCategory.severityOf(event.category()),
        tags,
        contexts,
        List.of(title, event.component(), event.category()),
        event.timestamp());
  }

  /** Builder for {@link TelemetryWorker}. */
  public static final class Builder {
    private String name = DEFAULT_NAME;
    private WorkerConfig config;
    private Transport transport;
    private MetricsExporter metrics;
    private Clock clock;
    private RateLimiter rateLimiter;
    private Sampler sampler;
    private EventFilter filter;
    private boolean enabled = true;

    private Builder() {}

    /**
     * Sets the consumer name used for bus registration and logging.
     *
     * <p>Optional. Defaults to {@value TelemetryWorker#DEFAULT_NAME}.
     */
    public Builder name(String name) {
      this.name = name;
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
     * Sets the backend client.
     *
     * <p><b>Required.</b>
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the time source for the breaker, the default rate limiter and delivery timing.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Replaces the rate limiter built from the configuration.
     *
     * <p>Optional. Defaults to a {@link SlidingWindowRateLimiter} using
     * {@link WorkerConfig#rateLimitWindow()} and {@link WorkerConfig#rateLimitMaxEvents()}.
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Optional. Defaults to {@link DeterministicSampler#INSTANCE}.
     */
    public Builder sampler(Sampler sampler) {
      this.sampler = sampler;
      return this;
    }

    /**
     * Optional. Defaults to {@link OperationalErrorFilter#INSTANCE}; use {@link EventFilter#ALL}
     * to report everything.
     */
    public Builder filter(EventFilter filter) {
      this.filter = filter;
      return this;
    }

    /**
     * Sets the initial state of the enabled flag.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * @return a new worker
     * @throws NullPointerException if {@code transport} or {@code name} is null
     */
    public TelemetryWorker build() {
      return new TelemetryWorker(this);
    }
  }
}
