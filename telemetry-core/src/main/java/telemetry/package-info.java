/**
 * Root API of the telemetry pipeline: resilient, privacy-preserving ingestion of application
 * error events.
 *
 * <h2>Core Design</h2>
 * <p>Code that catches an error turns it into an {@link telemetry.ErrorEvent} (directly or via
 * {@link telemetry.ErrorEvents}) and publishes it to the
 * {@linkplain telemetry.bus.AsyncEventBus event bus}. Publishing is a non-blocking offer; the
 * producer never waits for the backend. Bus threads hand the event to the
 * {@linkplain telemetry.worker.TelemetryWorker worker}, which applies its admission gates
 * (enabled flag, circuit breaker, rate limiter, sampler) in a fixed order, scrubs sensitive
 * data with the {@linkplain telemetry.privacy.PrivacyScrubber privacy scrubber}, and forwards
 * the result to a {@linkplain telemetry.spi.Transport transport}.
 *
 * <p>Delivery is best effort. Events are dropped rather than queued without bound, and a
 * failing or slow backend opens the circuit breaker instead of slowing the application.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>telemetry-core</b>: event model, gates, scrubber, worker, bus (depends only on
 *       ulid-creator)</li>
 *   <li><b>telemetry-micrometer</b>: {@linkplain telemetry.spi.MetricsExporter metrics} bridge
 *       to Micrometer</li>
 *   <li><b>telemetry-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (Telemetry telemetry = Telemetry.builder()
 *     .transport(new LoggingTransport())
 *     .config(WorkerConfig.builder()
 *         .rateLimitMaxEvents(50)
 *         .samplingRate(0.25)
 *         .build())
 *     .build()) {
 *
 *   try {
 *     store.save(detection);
 *   } catch (SQLException e) {
 *     telemetry.report(new TelemetryException("datastore", ErrorCategory.DATABASE,
 *         "save failed", e).with("operation", "save_detection"));
 *   }
 * }
 * }</pre>
 *
 * @see telemetry.Telemetry
 * @see telemetry.worker.TelemetryWorker
 */
package telemetry;
