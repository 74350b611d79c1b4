package telemetry.gate;

/**
 * Keyed admission control.
 *
 * @see SlidingWindowRateLimiter
 */
public interface RateLimiter {

  /**
   * Returns whether one more event for {@code key} may pass now. An admitted call counts
   * against the key's budget.
   *
   * @param key the rate-limit key, e.g. a component name
   * @return {@code true} if admitted
   */
  boolean allow(String key);
}
