package telemetry.transport;

import telemetry.TransportException;
import telemetry.spi.Transport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport that holds events until the real backend client is ready.
 *
 * <p>Until {@link #attach(Transport)} is called, {@link #send} appends to a bounded FIFO; when
 * the FIFO is full the oldest event is discarded. {@code attach} replays the buffered events in
 * order and from then on every call goes straight to the attached transport. Events that fail
 * during the replay are logged and skipped.
 *
 * <p>This class is thread-safe. Sends that race with {@code attach} are delivered after the
 * replayed events.
 */
public final class DeferredTransport implements Transport {
  private static final Logger logger = Logger.getLogger(DeferredTransport.class.getName());

  public static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final Deque<TransportEvent> pending = new ArrayDeque<>();
  private volatile Transport delegate;
  private long discarded;

  public DeferredTransport() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * @param capacity maximum number of buffered events (&gt; 0)
   */
  public DeferredTransport(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    this.capacity = capacity;
  }

  @Override
  public void send(TransportEvent event) throws TransportException {
    Objects.requireNonNull(event, "event");
    Transport target = delegate;
    if (target == null) {
      synchronized (this) {
        target = delegate;
        if (target == null) {
          buffer(event);
          return;
        }
      }
    }
    target.send(event);
  }

  /**
   * Connects the real transport and replays buffered events into it.
   *
   * @param transport the backend transport
   * @return the number of buffered events delivered successfully
   * @throws IllegalStateException if a transport is already attached
   */
  public synchronized int attach(Transport transport) {
    Objects.requireNonNull(transport, "transport");
    if (delegate != null) {
      throw new IllegalStateException("Transport already attached");
    }
    int delivered = 0;
    int total = pending.size();
    while (!pending.isEmpty()) {
      TransportEvent event = pending.pollFirst();
      try {
        transport.send(event);
        delivered++;
      } catch (TransportException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to replay deferred event " + event.eventId(), e);
      }
    }
    delegate = transport;
    logger.info("Transport attached; replayed " + delivered + " of " + total
        + " deferred events (" + discarded + " discarded earlier)");
    return delivered;
  }

  public boolean isAttached() {
    return delegate != null;
  }

  public synchronized int pendingCount() {
    return pending.size();
  }

  /**
   * Returns how many events were discarded because the buffer was full.
   */
  public synchronized long discardedCount() {
    return discarded;
  }

  /**
   * Delegates to the attached transport; returns {@code false} while none is attached.
   */
  @Override
  public boolean flush(Duration timeout) {
    Transport target = delegate;
    return target != null && target.flush(timeout);
  }

  private void buffer(TransportEvent event) {
    if (pending.size() >= capacity) {
      TransportEvent oldest = pending.pollFirst();
      discarded++;
      logger.log(Level.FINE, "Deferred buffer full; discarded event " + oldest.eventId());
    }
    pending.addLast(event);
  }
}
