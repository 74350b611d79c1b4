package telemetry.spi;

import telemetry.TransportException;
import telemetry.transport.TransportEvent;

import java.time.Duration;

/**
 * Client of the remote telemetry backend.
 *
 * <p>Implementations wrap a backend SDK. They receive events that have already been admitted
 * and scrubbed. The pipeline never retries: any retry policy belongs to the implementation.
 * A thrown {@link TransportException}, or a call slower than the configured slow threshold,
 * counts as a backend failure for the circuit breaker.
 *
 * @see telemetry.transport.LoggingTransport
 * @see telemetry.transport.DeferredTransport
 */
public interface Transport {

  /**
   * Sends one event to the backend.
   *
   * @param event the scrubbed event
   * @throws TransportException if the backend rejected the event or could not be reached
   */
  void send(TransportEvent event) throws TransportException;

  /**
   * Waits until buffered events have been delivered or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if everything was flushed in time
   */
  boolean flush(Duration timeout);
}
