/**
 * The gating and forwarding pipeline.
 *
 * <p>{@link telemetry.worker.TelemetryWorker} is an {@link telemetry.EventConsumer} that owns
 * one circuit breaker, one rate limiter and one set of counters. Its behaviour is set by an
 * immutable {@link telemetry.worker.WorkerConfig}; {@link telemetry.worker.WorkerStats} is the
 * snapshot read by health checks.
 */
package telemetry.worker;
