package telemetry.util;

import telemetry.gate.CircuitState;
import telemetry.spi.MetricsExporter;
import telemetry.worker.DropReason;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics exporter that keeps every call for assertions.
 */
public class RecordingMetrics implements MetricsExporter, AutoCloseable {

    public final AtomicLong processed = new AtomicLong();
    public final AtomicLong failed = new AtomicLong();
    public final AtomicLong slow = new AtomicLong();
    public final AtomicLong busRejected = new AtomicLong();
    public final AtomicLong busDeduplicated = new AtomicLong();
    public final AtomicInteger lastQueueDepth = new AtomicInteger(-1);
    public final Map<DropReason, AtomicLong> dropped = new ConcurrentHashMap<>();
    public final List<CircuitState> circuitStates = new CopyOnWriteArrayList<>();
    public final List<Long> latencies = new CopyOnWriteArrayList<>();
    public volatile boolean closed;

    @Override
    public void incrementProcessed() {
        processed.incrementAndGet();
    }

    @Override
    public void incrementDropped(DropReason reason) {
        dropped.computeIfAbsent(reason, r -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void incrementFailed() {
        failed.incrementAndGet();
    }

    @Override
    public void incrementSlowDelivery() {
        slow.incrementAndGet();
    }

    @Override
    public void recordCircuitState(CircuitState state) {
        circuitStates.add(state);
    }

    @Override
    public void recordTransportLatencyMs(long latencyMs) {
        latencies.add(latencyMs);
    }

    @Override
    public void incrementBusRejected() {
        busRejected.incrementAndGet();
    }

    @Override
    public void incrementBusDeduplicated() {
        busDeduplicated.incrementAndGet();
    }

    @Override
    public void recordBusQueueDepth(int depth) {
        lastQueueDepth.set(depth);
    }

    public long dropped(DropReason reason) {
        AtomicLong count = dropped.get(reason);
        return count == null ? 0 : count.get();
    }

    @Override
    public void close() {
        closed = true;
    }
}
