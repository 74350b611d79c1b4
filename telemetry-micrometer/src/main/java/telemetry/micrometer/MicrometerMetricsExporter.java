package telemetry.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import telemetry.gate.CircuitState;
import telemetry.spi.MetricsExporter;
import telemetry.worker.DropReason;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code telemetry.events.processed}: events handed to the transport</li>
 *   <li>{@code telemetry.events.dropped}: events dropped by a gate, tagged {@code reason}</li>
 *   <li>{@code telemetry.events.failed}: events the transport failed to deliver</li>
 *   <li>{@code telemetry.events.slow}: deliveries slower than the slow threshold</li>
 *   <li>{@code telemetry.bus.rejected}: events refused by a full or closed event bus</li>
 *   <li>{@code telemetry.bus.deduplicated}: repeats suppressed by the event bus</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code telemetry.circuit.state}: 0 closed, 1 half-open, 2 open</li>
 *   <li>{@code telemetry.bus.queue.depth}: current event bus queue depth</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code telemetry.transport.latency.ms}: duration of each transport call</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "telemetry";

  private final MeterRegistry registry;
  private final Counter processed;
  private final Map<DropReason, Counter> dropped = new EnumMap<>(DropReason.class);
  private final Counter failed;
  private final Counter slow;
  private final Counter busRejected;
  private final Counter busDeduplicated;
  private final Gauge circuitStateGauge;
  private final Gauge queueDepthGauge;
  private final DistributionSummary transportLatency;

  private final AtomicInteger circuitState = new AtomicInteger();
  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "telemetry"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "birdnet.telemetry"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.processed = Counter.builder(namePrefix + ".events.processed")
        .description("Events handed to the transport")
        .register(registry);
    for (DropReason reason : DropReason.values()) {
      dropped.put(reason, Counter.builder(namePrefix + ".events.dropped")
          .description("Events dropped before delivery")
          .tag("reason", reason.tagValue())
          .register(registry));
    }
    this.failed = Counter.builder(namePrefix + ".events.failed")
        .description("Events the transport failed to deliver")
        .register(registry);
    this.slow = Counter.builder(namePrefix + ".events.slow")
        .description("Deliveries slower than the slow threshold")
        .register(registry);
    this.busRejected = Counter.builder(namePrefix + ".bus.rejected")
        .description("Events refused by the event bus")
        .register(registry);
    this.busDeduplicated = Counter.builder(namePrefix + ".bus.deduplicated")
        .description("Repeated events suppressed by the event bus")
        .register(registry);

    this.circuitStateGauge = Gauge.builder(namePrefix + ".circuit.state", circuitState, AtomicInteger::get)
        .description("Circuit breaker state: 0 closed, 1 half-open, 2 open")
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".bus.queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);

    this.transportLatency = DistributionSummary.builder(namePrefix + ".transport.latency.ms")
        .description("Transport call duration in milliseconds")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementProcessed() {
    if (closed) return;
    processed.increment();
  }

  @Override
  public void incrementDropped(DropReason reason) {
    if (closed) return;
    dropped.get(reason).increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementSlowDelivery() {
    if (closed) return;
    slow.increment();
  }

  @Override
  public void recordCircuitState(CircuitState state) {
    if (closed) return;
    circuitState.set(switch (state) {
      case CLOSED -> 0;
      case HALF_OPEN -> 1;
      case OPEN -> 2;
    });
  }

  @Override
  public void recordTransportLatencyMs(long latencyMs) {
    if (closed) return;
    transportLatency.record(latencyMs);
  }

  @Override
  public void incrementBusRejected() {
    if (closed) return;
    busRejected.increment();
  }

  @Override
  public void incrementBusDeduplicated() {
    if (closed) return;
    busDeduplicated.increment();
  }

  @Override
  public void recordBusQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link telemetry.Telemetry#close()} calls this, so stale gauges do not outlive the
   * pipeline.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(processed, failed, slow, busRejected,
        busDeduplicated, circuitStateGauge, queueDepthGauge, transportLatency));
    meters.addAll(dropped.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
