package telemetry.worker;

/**
 * Which key the worker's rate limiter counts events under.
 */
public enum RateLimitScope {
  /** One budget shared by all components. */
  GLOBAL,
  /** A separate budget per component name. */
  PER_COMPONENT;

  static final String GLOBAL_KEY = "global";

  /**
   * Returns the rate-limit key for an event raised by {@code component}.
   */
  public String keyFor(String component) {
    return this == GLOBAL ? GLOBAL_KEY : component;
  }
}
