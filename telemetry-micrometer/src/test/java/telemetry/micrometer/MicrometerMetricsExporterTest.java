package telemetry.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import telemetry.ErrorEvent;
import telemetry.TransportException;
import telemetry.gate.CircuitState;
import telemetry.spi.Transport;
import telemetry.transport.TransportEvent;
import telemetry.worker.DropReason;
import telemetry.worker.TelemetryWorker;
import telemetry.worker.WorkerConfig;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementProcessed() {
    exporter.incrementProcessed();
    exporter.incrementProcessed();
    assertEquals(2.0, counter("telemetry.events.processed").count());
  }

  @Test
  void droppedIsTaggedByReason() {
    exporter.incrementDropped(DropReason.RATE_LIMITED);
    exporter.incrementDropped(DropReason.RATE_LIMITED);
    exporter.incrementDropped(DropReason.CIRCUIT_OPEN);

    assertEquals(2.0, registry.get("telemetry.events.dropped").tag("reason", "rate_limited").counter().count());
    assertEquals(1.0, registry.get("telemetry.events.dropped").tag("reason", "circuit_open").counter().count());
    assertEquals(0.0, registry.get("telemetry.events.dropped").tag("reason", "unsampled").counter().count());
  }

  @Test
  void failedSlowRejectedAndDeduplicated() {
    exporter.incrementFailed();
    exporter.incrementSlowDelivery();
    exporter.incrementBusRejected();
    exporter.incrementBusRejected();
    exporter.incrementBusDeduplicated();

    assertEquals(1.0, counter("telemetry.events.failed").count());
    assertEquals(1.0, counter("telemetry.events.slow").count());
    assertEquals(2.0, counter("telemetry.bus.rejected").count());
    assertEquals(1.0, counter("telemetry.bus.deduplicated").count());
  }

  @Test
  void circuitStateGauge() {
    exporter.recordCircuitState(CircuitState.OPEN);
    assertEquals(2.0, gauge("telemetry.circuit.state").value());
    exporter.recordCircuitState(CircuitState.HALF_OPEN);
    assertEquals(1.0, gauge("telemetry.circuit.state").value());
    exporter.recordCircuitState(CircuitState.CLOSED);
    assertEquals(0.0, gauge("telemetry.circuit.state").value());
  }

  @Test
  void queueDepthGauge() {
    exporter.recordBusQueueDepth(42);
    assertEquals(42.0, gauge("telemetry.bus.queue.depth").value());
  }

  @Test
  void transportLatencyKeepsEveryCall() {
    exporter.recordTransportLatencyMs(100L);
    exporter.recordTransportLatencyMs(300L);
    exporter.recordTransportLatencyMs(1200L);

    DistributionSummary latency = summary("telemetry.transport.latency.ms");
    assertEquals(3, latency.count());
    assertEquals(1600.0, latency.totalAmount());
    assertEquals(1200.0, latency.max());
    assertNull(registry.find("telemetry.transport.latency.ms").gauge());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "birdnet.telemetry");
    custom.incrementProcessed();
    custom.recordBusQueueDepth(10);

    assertEquals(1.0, counter("birdnet.telemetry.events.processed").count());
    assertEquals(10.0, gauge("birdnet.telemetry.bus.queue.depth").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();
    exporter.incrementProcessed();

    assertNull(registry.find("telemetry.events.processed").counter());
    assertNull(registry.find("telemetry.events.dropped").counter());
    assertNull(registry.find("telemetry.circuit.state").gauge());
    assertNull(registry.find("telemetry.transport.latency.ms").summary());
  }

  @Test
  void workerReportsThroughExporter() throws TransportException {
    Transport transport = new Transport() {
      @Override
      public void send(TransportEvent event) {
      }

      @Override
      public boolean flush(Duration timeout) {
        return true;
      }
    };
    TelemetryWorker worker = TelemetryWorker.builder()
        .transport(transport)
        .metrics(exporter)
        .config(WorkerConfig.builder().rateLimitMaxEvents(1).build())
        .build();

    worker.processEvent(ErrorEvent.builder("a").component("camera").build());
    worker.processEvent(ErrorEvent.builder("b").component("camera").build());

    assertEquals(1.0, counter("telemetry.events.processed").count());
    assertEquals(1.0, registry.get("telemetry.events.dropped").tag("reason", "rate_limited").counter().count());
    assertEquals(0.0, gauge("telemetry.circuit.state").value());
    assertEquals(1, summary("telemetry.transport.latency.ms").count());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private DistributionSummary summary(String name) {
    DistributionSummary s = registry.find(name).summary();
    assertNotNull(s, "Summary not found: " + name);
    return s;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
