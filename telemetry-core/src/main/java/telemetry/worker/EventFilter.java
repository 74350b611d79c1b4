package telemetry.worker;

import telemetry.ErrorEvent;

import java.util.Objects;

/**
 * Decides whether an admitted event is worth reporting at all.
 *
 * <p>Rejected events are marked reported and counted as {@link DropReason#FILTERED}, so they are
 * never sent again by another consumer.
 *
 * @see OperationalErrorFilter
 */
@FunctionalInterface
public interface EventFilter {

  /** Filter that reports every event. */
  EventFilter ALL = event -> true;

  /**
   * @param event the admitted event
   * @return {@code true} to send the event, {@code false} to drop it
   */
  boolean shouldReport(ErrorEvent event);

  /**
   * Returns a filter that reports an event only if both filters do.
   */
  default EventFilter and(EventFilter other) {
    Objects.requireNonNull(other, "other");
    return event -> shouldReport(event) && other.shouldReport(event);
  }
}
