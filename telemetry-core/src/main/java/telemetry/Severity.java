package telemetry;

/**
 * Severity attached to an event when it is handed to a {@link telemetry.spi.Transport}.
 *
 * @see ErrorCategory#severity()
 */
public enum Severity {
  DEBUG,
  INFO,
  WARNING,
  ERROR,
  FATAL
}
