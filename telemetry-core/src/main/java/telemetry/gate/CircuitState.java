package telemetry.gate;

/**
 * State of a {@link CircuitBreaker}.
 *
 * <pre>
 * CLOSED ──(failures ≥ threshold)──▶ OPEN
 * OPEN ──(recovery timeout elapsed)──▶ HALF_OPEN
 * HALF_OPEN ──(cap successes)──▶ CLOSED
 * HALF_OPEN ──(any failure)──▶ OPEN
 * </pre>
 */
public enum CircuitState {
  /** Events flow; consecutive failures are counted. */
  CLOSED("closed"),
  /** Events are rejected until the recovery timeout elapses. */
  OPEN("open"),
  /** A limited number of trial events are admitted to test recovery. */
  HALF_OPEN("half-open");

  private final String wireName;

  CircuitState(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lower-case name used in stats snapshots and logs, e.g. {@code "half-open"}.
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Returns whether moving from this state to {@code next} is a legal transition.
   */
  public boolean canTransitionTo(CircuitState next) {
    return switch (this) {
      case CLOSED -> next == OPEN;
      case OPEN -> next == HALF_OPEN;
      case HALF_OPEN -> next == CLOSED || next == OPEN;
    };
  }
}
