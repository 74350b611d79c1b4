package telemetry.gate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three-state failure-isolation gate in front of the telemetry backend.
 *
 * <p>While {@link CircuitState#CLOSED} every call is allowed and consecutive failures are
 * counted; reaching {@code failureThreshold} opens the circuit. While {@link CircuitState#OPEN}
 * calls are rejected until more than {@code recoveryTimeout} has passed since the last failure;
 * the next {@link #allow()} then moves to {@link CircuitState#HALF_OPEN}. Half-open admits calls
 * until {@code halfOpenMaxEvents} successes have been recorded, which closes the circuit; a single
 * failure while half-open reopens it.
 *
 * <p>This class is thread-safe. All state is guarded by the instance monitor; the transition
 * listener runs after the monitor is released.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final int failureThreshold;
  private final Duration recoveryTimeout;
  private final int halfOpenMaxEvents;
  private final Clock clock;
  private final Consumer<CircuitState> transitionListener;

  private CircuitState state = CircuitState.CLOSED;
  private int consecutiveFailures;
  private int halfOpenSuccesses;
  private Instant lastFailureTime;

  /**
   * Creates a breaker using the system clock.
   *
   * @param failureThreshold  consecutive failures that open the circuit (&ge; 1)
   * @param recoveryTimeout   time after the last failure before probing (&gt; 0)
   * @param halfOpenMaxEvents successes needed to close from half-open (&ge; 1)
   */
  public CircuitBreaker(int failureThreshold, Duration recoveryTimeout, int halfOpenMaxEvents) {
    this(failureThreshold, recoveryTimeout, halfOpenMaxEvents, Clock.systemUTC(), state -> { });
  }

  /**
   * Creates a breaker with an explicit clock and a listener notified after each transition.
   */
  public CircuitBreaker(int failureThreshold, Duration recoveryTimeout, int halfOpenMaxEvents,
      Clock clock, Consumer<CircuitState> transitionListener) {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
    }
    Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
    if (recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
      throw new IllegalArgumentException("recoveryTimeout must be > 0, got: " + recoveryTimeout);
    }
    if (halfOpenMaxEvents < 1) {
      throw new IllegalArgumentException("halfOpenMaxEvents must be >= 1, got: " + halfOpenMaxEvents);
    }
    this.failureThreshold = failureThreshold;
    this.recoveryTimeout = recoveryTimeout;
    this.halfOpenMaxEvents = halfOpenMaxEvents;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.transitionListener = Objects.requireNonNull(transitionListener, "transitionListener");
  }

  /**
   * Returns whether a call to the backend may proceed. May move an open circuit to half-open.
   *
   * @return {@code true} if the call is admitted
   */
  public boolean allow() {
    CircuitState transitioned = null;
    boolean allowed;
    synchronized (this) {
      switch (state) {
        case CLOSED -> allowed = true;
        case OPEN -> {
          Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
          if (sinceFailure.compareTo(recoveryTimeout) > 0) {
            transitionTo(CircuitState.HALF_OPEN);
            halfOpenSuccesses = 0;
            transitioned = CircuitState.HALF_OPEN;
            allowed = true;
          } else {
            allowed = false;
          }
        }
        case HALF_OPEN -> allowed = halfOpenSuccesses < halfOpenMaxEvents;
        default -> throw new IllegalStateException("Unknown state: " + state);
      }
    }
    notifyTransition(transitioned);
    return allowed;
  }

  /**
   * Records a successful backend call.
   */
  public void recordSuccess() {
    CircuitState transitioned = null;
    synchronized (this) {
      switch (state) {
        case CLOSED -> consecutiveFailures = 0;
        case HALF_OPEN -> {
          halfOpenSuccesses++;
          if (halfOpenSuccesses >= halfOpenMaxEvents) {
            transitionTo(CircuitState.CLOSED);
            consecutiveFailures = 0;
            transitioned = CircuitState.CLOSED;
          }
        }
        case OPEN -> {
          // late success from a call admitted before the circuit opened
        }
        default -> throw new IllegalStateException("Unknown state: " + state);
      }
    }
    notifyTransition(transitioned);
  }

  /**
   * Records a failed (or unacceptably slow) backend call.
   */
  public void recordFailure() {
    CircuitState transitioned = null;
    synchronized (this) {
      Instant now = clock.instant();
      lastFailureTime = now;
      switch (state) {
        case CLOSED -> {
          consecutiveFailures++;
          if (consecutiveFailures >= failureThreshold) {
            transitionTo(CircuitState.OPEN);
            transitioned = CircuitState.OPEN;
          }
        }
        case HALF_OPEN -> {
          transitionTo(CircuitState.OPEN);
          consecutiveFailures = failureThreshold;
          transitioned = CircuitState.OPEN;
        }
        case OPEN -> {
          // lastFailureTime refreshed above; stays open
        }
        default -> throw new IllegalStateException("Unknown state: " + state);
      }
    }
    notifyTransition(transitioned);
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  public synchronized int halfOpenSuccesses() {
    return halfOpenSuccesses;
  }

  /**
   * Returns the time of the most recent failure, or {@code null} if none was recorded.
   */
  public synchronized Instant lastFailureTime() {
    return lastFailureTime;
  }

  private void transitionTo(CircuitState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal circuit transition " + state + " -> " + next);
    }
    CircuitState previous = state;
    state = next;
    Level level = next == CircuitState.OPEN ? Level.WARNING : Level.INFO;
    logger.log(level, "Telemetry circuit breaker " + previous.wireName() + " -> " + next.wireName()
        + " (consecutiveFailures=" + consecutiveFailures + ")");
  }

  private void notifyTransition(CircuitState transitioned) {
    if (transitioned == null) return;
    try {
      transitionListener.accept(transitioned);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Circuit transition listener failed", e);
    }
  }
}
