package telemetry;

import java.util.List;

/**
 * Subscriber of the event bus that receives {@link ErrorEvent}s.
 *
 * <p>Consumers are invoked on bus worker threads, never on the thread that produced the error.
 * Implementations must be thread-safe: several workers may call {@link #processEvent} at once.
 *
 * <h2>Error Handling</h2>
 * <p>A {@link TransportException} only tells the bus that delivery failed so it can be logged.
 * It is never surfaced to the producer and never causes a retry.
 *
 * @see telemetry.bus.AsyncEventBus
 * @see telemetry.worker.TelemetryWorker
 */
public interface EventConsumer {

  /**
   * Returns a stable identifier used for registration and logging.
   */
  String name();

  /**
   * Processes exactly one event.
   *
   * @param event the event
   * @throws TransportException if the event was admitted but could not be delivered
   */
  void processEvent(ErrorEvent event) throws TransportException;

  /**
   * Processes a sequence of events independently. A failure on one event does not stop the
   * remaining events from being processed.
   *
   * <p>The default implementation calls {@link #processEvent} for each element, so batch and
   * single-event delivery make identical admission decisions.
   *
   * @param events the events, in delivery order
   * @throws TransportException the first failure; later failures are attached as suppressed
   */
  default void processBatch(List<ErrorEvent> events) throws TransportException {
    TransportException first = null;
    for (ErrorEvent event : events) {
      try {
        processEvent(event);
      } catch (TransportException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Returns whether batch delivery is beneficial for this consumer.
   */
  default boolean supportsBatching() {
    return false;
  }
}
