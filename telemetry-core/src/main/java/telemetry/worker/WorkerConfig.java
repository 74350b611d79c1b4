package telemetry.worker;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of a {@link TelemetryWorker}.
 *
 * <p>Every field has a default, so {@code WorkerConfig.builder().build()} is a usable
 * configuration. Invalid values are rejected by {@link Builder#build()}, never at event time.
 */
public final class WorkerConfig {
  private final int failureThreshold;
  private final Duration recoveryTimeout;
  private final int halfOpenMaxEvents;
  private final Duration rateLimitWindow;
  private final int rateLimitMaxEvents;
  private final RateLimitScope rateLimitScope;
  private final double samplingRate;
  private final Duration slowThreshold;
  private final boolean batchingEnabled;
  private final int batchSize;
  private final Duration batchTimeout;

  private WorkerConfig(Builder builder) {
    this.failureThreshold = builder.failureThreshold;
    this.recoveryTimeout = builder.recoveryTimeout;
    this.halfOpenMaxEvents = builder.halfOpenMaxEvents;
    this.rateLimitWindow = builder.rateLimitWindow;
    this.rateLimitMaxEvents = builder.rateLimitMaxEvents;
    this.rateLimitScope = builder.rateLimitScope;
    this.samplingRate = builder.samplingRate;
    this.slowThreshold = builder.slowThreshold;
    this.batchingEnabled = builder.batchingEnabled;
    this.batchSize = builder.batchSize;
    this.batchTimeout = builder.batchTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a configuration with every field at its default.
   */
  public static WorkerConfig defaults() {
    return builder().build();
  }

  /**
   * Returns a builder pre-filled with this configuration's values.
   */
  public Builder toBuilder() {
    return new Builder()
        .failureThreshold(failureThreshold)
        .recoveryTimeout(recoveryTimeout)
        .halfOpenMaxEvents(halfOpenMaxEvents)
        .rateLimitWindow(rateLimitWindow)
        .rateLimitMaxEvents(rateLimitMaxEvents)
        .rateLimitScope(rateLimitScope)
        .samplingRate(samplingRate)
        .slowThreshold(slowThreshold)
        .batchingEnabled(batchingEnabled)
        .batchSize(batchSize)
        .batchTimeout(batchTimeout);
  }

  public int failureThreshold() {
    return failureThreshold;
  }

  public Duration recoveryTimeout() {
    return recoveryTimeout;
  }

  public int halfOpenMaxEvents() {
    return halfOpenMaxEvents;
  }

  public Duration rateLimitWindow() {
    return rateLimitWindow;
  }

  public int rateLimitMaxEvents() {
    return rateLimitMaxEvents;
  }

  public RateLimitScope rateLimitScope() {
    return rateLimitScope;
  }

  public double samplingRate() {
    return samplingRate;
  }

  public Duration slowThreshold() {
    return slowThreshold;
  }

  public boolean batchingEnabled() {
    return batchingEnabled;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration batchTimeout() {
    return batchTimeout;
  }

  @Override
  public String toString() {
    return "WorkerConfig{failureThreshold=" + failureThreshold
        + ", recoveryTimeout=" + recoveryTimeout
        + ", halfOpenMaxEvents=" + halfOpenMaxEvents
        + ", rateLimitWindow=" + rateLimitWindow
        + ", rateLimitMaxEvents=" + rateLimitMaxEvents
        + ", rateLimitScope=" + rateLimitScope
        + ", samplingRate=" + samplingRate
        + ", slowThreshold=" + slowThreshold
        + ", batchingEnabled=" + batchingEnabled
        + ", batchSize=" + batchSize
        + ", batchTimeout=" + batchTimeout
        + '}';
  }

  /** Builder for {@link WorkerConfig}. */
  public static final class Builder {
    private int failureThreshold = 5;
    private Duration recoveryTimeout = Duration.ofSeconds(30);
    private int halfOpenMaxEvents = 3;
    private Duration rateLimitWindow = Duration.ofMinutes(1);
    private int rateLimitMaxEvents = 100;
    private RateLimitScope rateLimitScope = RateLimitScope.PER_COMPONENT;
    private double samplingRate = 1.0;
    private Duration slowThreshold = Duration.ofSeconds(5);
    private boolean batchingEnabled;
    private int batchSize = 10;
    private Duration batchTimeout = Duration.ofMillis(100);

    private Builder() {}

    /**
     * Consecutive failures that open the circuit breaker.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Time after the last failure before an open breaker lets a trial event through.
     *
     * <p>Optional. Defaults to 30 seconds. Must be &gt; 0.
     */
    public Builder recoveryTimeout(Duration recoveryTimeout) {
      this.recoveryTimeout = recoveryTimeout;
      return this;
    }

    /**
     * Successes needed to close a half-open breaker; also the admission cap while half-open.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder halfOpenMaxEvents(int halfOpenMaxEvents) {
      this.halfOpenMaxEvents = halfOpenMaxEvents;
      return this;
    }

    /**
     * Length of the rate limiter's sliding window.
     *
     * <p>Optional. Defaults to 1 minute. Must be &gt; 0.
     */
    public Builder rateLimitWindow(Duration rateLimitWindow) {
      this.rateLimitWindow = rateLimitWindow;
      return this;
    }

    /**
     * Events admitted per key within one window.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &ge; 0; {@code 0} admits nothing.
     */
    public Builder rateLimitMaxEvents(int rateLimitMaxEvents) {
      this.rateLimitMaxEvents = rateLimitMaxEvents;
      return this;
    }

    /**
     * Optional. Defaults to {@link RateLimitScope#PER_COMPONENT}.
     */
    public Builder rateLimitScope(RateLimitScope rateLimitScope) {
      this.rateLimitScope = rateLimitScope;
      return this;
    }

    /**
     * Fraction of {@code (component, category)} pairs to report.
     *
     * <p>Optional. Defaults to {@code 1.0}. Must be in [0, 1].
     */
    public Builder samplingRate(double samplingRate) {
      this.samplingRate = samplingRate;
      return this;
    }

    /**
     * Latency above which a successful send still counts as a breaker failure.
     *
     * <p>Optional. Defaults to 5 seconds. Must be &gt; 0.
     */
    public Builder slowThreshold(Duration slowThreshold) {
      this.slowThreshold = slowThreshold;
      return this;
    }

    /**
     * Whether the worker asks the event bus for batches. Admission decisions are the same
     * either way.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder batchingEnabled(boolean batchingEnabled) {
      this.batchingEnabled = batchingEnabled;
      return this;
    }

    /**
     * Optional. Defaults to {@code 10}. Must be &ge; 1.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Longest time the bus waits to fill a batch.
     *
     * <p>Optional. Defaults to 100 ms. Must be &gt; 0.
     */
    public Builder batchTimeout(Duration batchTimeout) {
      this.batchTimeout = batchTimeout;
      return this;
    }

    /**
     * @return a new {@link WorkerConfig}
     * @throws NullPointerException if a duration or the scope is null
     * @throws IllegalArgumentException if any value is out of range
     */
    public WorkerConfig build() {
      if (failureThreshold < 1) {
        throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
      }
      requirePositive(recoveryTimeout, "recoveryTimeout");
      if (halfOpenMaxEvents < 1) {
        throw new IllegalArgumentException("halfOpenMaxEvents must be >= 1, got: " + halfOpenMaxEvents);
      }
      requirePositive(rateLimitWindow, "rateLimitWindow");
      if (rateLimitMaxEvents < 0) {
        throw new IllegalArgumentException("rateLimitMaxEvents must be >= 0, got: " + rateLimitMaxEvents);
      }
      Objects.requireNonNull(rateLimitScope, "rateLimitScope");
      if (Double.isNaN(samplingRate) || samplingRate < 0.0 || samplingRate > 1.0) {
        throw new IllegalArgumentException("samplingRate must be in [0, 1], got: " + samplingRate);
      }
      requirePositive(slowThreshold, "slowThreshold");
      if (batchSize < 1) {
        throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
      }
      requirePositive(batchTimeout, "batchTimeout");
      return new WorkerConfig(this);
    }

    private static void requirePositive(Duration value, String name) {
      Objects.requireNonNull(value, name);
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(name + " must be > 0, got: " + value);
      }
    }
  }
}
