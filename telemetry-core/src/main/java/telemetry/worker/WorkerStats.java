package telemetry.worker;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time snapshot of a worker's counters.
 *
 * <p>Counters only grow over the lifetime of a worker. {@code dropped} is the sum of
 * {@code droppedByReason}.
 *
 * @param processed      events handed to the transport without error, slow ones included
 * @param dropped        events dropped by an admission gate or filter
 * @param failed         events the transport failed to deliver
 * @param slowDeliveries successful deliveries slower than the slow threshold
 * @param circuitState   wire name of the breaker state, e.g. {@code "half-open"}
 * @param droppedByReason drop counts per reason; every reason is present
 */
public record WorkerStats(
    long processed,
    long dropped,
    long failed,
    long slowDeliveries,
    String circuitState,
    Map<DropReason, Long> droppedByReason) {

  public WorkerStats {
    Map<DropReason, Long> copy = new EnumMap<>(DropReason.class);
    copy.putAll(droppedByReason);
    droppedByReason = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the number of events dropped for {@code reason}.
   */
  public long dropped(DropReason reason) {
    return droppedByReason.getOrDefault(reason, 0L);
  }
}
