/**
 * Admission gates that decide whether an event may be forwarded.
 *
 * <p>{@link telemetry.gate.CircuitBreaker} isolates a failing backend,
 * {@link telemetry.gate.SlidingWindowRateLimiter} sheds load per key, and
 * {@link telemetry.gate.DeterministicSampler} keeps a stable fraction of
 * {@code (component, category)} pairs. Each gate guards its own state; none
 * holds a lock while another gate runs.
 *
 * @see telemetry.worker.TelemetryWorker
 */
package telemetry.gate;
