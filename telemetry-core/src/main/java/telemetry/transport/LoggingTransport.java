package telemetry.transport;

import telemetry.spi.Transport;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport that writes events to {@code java.util.logging} instead of a remote backend.
 *
 * <p>Used when no backend client is configured, and handy in development. Events are already
 * scrubbed, so the full message is logged.
 */
public final class LoggingTransport implements Transport {
  private static final Logger logger = Logger.getLogger(LoggingTransport.class.getName());

  private final Level level;

  public LoggingTransport() {
    this(Level.INFO);
  }

  public LoggingTransport(Level level) {
    this.level = Objects.requireNonNull(level, "level");
  }

  @Override
  public void send(TransportEvent event) {
    if (!logger.isLoggable(level)) {
      return;
    }
    logger.log(level, "[" + event.severity() + "] " + event.title() + " - " + event.message()
        + " tags=" + event.tags() + " contexts=" + event.contexts()
        + " eventId=" + event.eventId());
  }

  @Override
  public boolean flush(Duration timeout) {
    return true;
  }
}
