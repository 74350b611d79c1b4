package telemetry.worker;

import java.util.Locale;

/**
 * Why the worker dropped an event without sending it.
 */
public enum DropReason {
  /** Reporting is switched off. */
  DISABLED,
  /** The circuit breaker is open or its half-open trial budget is spent. */
  CIRCUIT_OPEN,
  /** The sliding-window budget for the event's key is exhausted. */
  RATE_LIMITED,
  /** The event's {@code (component, category)} pair falls outside the sampling rate. */
  UNSAMPLED,
  /** An {@link EventFilter} classified the event as an operational error. */
  FILTERED;

  /**
   * Returns the lowercase name used as a metric tag, e.g. {@code "circuit_open"}.
   */
  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
