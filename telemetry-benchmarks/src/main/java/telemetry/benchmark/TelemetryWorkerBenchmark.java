package telemetry.benchmark;

import org.openjdk.jmh.annotations.*;
import telemetry.ErrorEvent;
import telemetry.TransportException;
import telemetry.spi.Transport;
import telemetry.transport.TransportEvent;
import telemetry.worker.TelemetryWorker;
import telemetry.worker.WorkerConfig;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Measures the synchronous gating path of {@link TelemetryWorker}: filter, rate limit, sampling,
 * circuit breaker, scrubbing and conversion to a {@link TransportEvent}.
 *
 * <p>{@code admitted} lets every event through to a no-op transport; {@code limited} rejects
 * every event at the rate limiter after the first.
 *
 * <p>Run: {@code java -jar telemetry-benchmarks/target/benchmarks.jar TelemetryWorkerBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class TelemetryWorkerBenchmark {

  @Param({"admitted", "limited"})
  private String path;

  private TelemetryWorker worker;
  private ErrorEvent event;
  private final LongAdder delivered = new LongAdder();

  @Setup(Level.Trial)
  public void setup() {
    WorkerConfig config = switch (path) {
      case "admitted" -> WorkerConfig.builder()
          .rateLimitWindow(Duration.ofMillis(1))
          .rateLimitMaxEvents(1_000_000)
          .build();
      case "limited" -> WorkerConfig.builder()
          .rateLimitMaxEvents(1)
          .build();
      default -> throw new IllegalArgumentException("unknown path: " + path);
    };

    worker = TelemetryWorker.builder()
        .config(config)
        .transport(new CountingTransport(delivered))
        .build();
    event = ErrorEvent.builder(new IllegalStateException(
            "connection to 10.0.0.5 refused for user@example.com"))
        .component("datastore")
        .context("operation", "save_detection")
        .build();
  }

  @Benchmark
  public long processEvent() throws TransportException {
    worker.processEvent(event);
    return delivered.sum();
  }

  private record CountingTransport(LongAdder counter) implements Transport {
    @Override
    public void send(TransportEvent event) {
      counter.increment();
    }

    @Override
    public boolean flush(Duration timeout) {
      return true;
    }
  }
}
