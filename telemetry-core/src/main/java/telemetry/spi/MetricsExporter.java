package telemetry.spi;

import telemetry.gate.CircuitState;
import telemetry.worker.DropReason;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events delivered to the transport.
     */
    void incrementProcessed();

    /**
     * Increments the count of events dropped by an admission gate.
     *
     * @param reason which gate dropped the event
     */
    void incrementDropped(DropReason reason);

    /**
     * Increments the count of events the transport failed to deliver.
     */
    void incrementFailed();

    /**
     * Increments the count of successful deliveries slower than the slow threshold.
     */
    default void incrementSlowDelivery() {
    }

    /**
     * Records the circuit breaker state after a transition.
     *
     * @param state the new state
     */
    void recordCircuitState(CircuitState state);

    /**
     * Records how long a single transport call took.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordTransportLatencyMs(long latencyMs) {
    }

    /**
     * Increments the count of events the event bus refused because its queue was full or closed.
     */
    default void incrementBusRejected() {
    }

    /**
     * Increments the count of events the event bus suppressed as repeats of a recent event.
     */
    default void incrementBusDeduplicated() {
    }

    /**
     * Records the current depth of the event bus queue.
     *
     * @param depth number of queued events
     */
    default void recordBusQueueDepth(int depth) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementProcessed() {
        }

        @Override
        public void incrementDropped(DropReason reason) {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void recordCircuitState(CircuitState state) {
        }
    }
}
