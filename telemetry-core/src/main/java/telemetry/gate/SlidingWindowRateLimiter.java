package telemetry.gate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Sliding-window rate limiter keeping the admission timestamps of each key.
 *
 * <p>On every {@link #allow(String)} the key's timestamps at or before {@code now - window} are
 * purged; the call is admitted iff fewer than {@code maxEvents} remain, and the admission time is
 * then appended. A key never seen before is always admitted when {@code maxEvents >= 1}.
 *
 * <p>When more than {@code maxKeys} keys are tracked, keys without a timestamp inside the
 * current window are dropped, bounding memory under unbounded key cardinality.
 *
 * <p>This class is thread-safe.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {
  public static final int DEFAULT_MAX_KEYS = 1024;

  private final long windowMs;
  private final int maxEvents;
  private final int maxKeys;
  private final Clock clock;
  private final Map<String, Deque<Long>> admissions = new HashMap<>();

  /**
   * Creates a limiter using the system clock and the default key bound.
   *
   * @param window    length of the sliding window (&gt; 0)
   * @param maxEvents admissions allowed per key within one window (&ge; 0)
   */
  public SlidingWindowRateLimiter(Duration window, int maxEvents) {
    this(window, maxEvents, DEFAULT_MAX_KEYS, Clock.systemUTC());
  }

  /**
   * @param window    length of the sliding window (&gt; 0)
   * @param maxEvents admissions allowed per key within one window (&ge; 0)
   * @param maxKeys   number of tracked keys above which idle keys are compacted (&ge; 1)
   * @param clock     time source
   */
  public SlidingWindowRateLimiter(Duration window, int maxEvents, int maxKeys, Clock clock) {
    Objects.requireNonNull(window, "window");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be > 0, got: " + window);
    }
    if (maxEvents < 0) {
      throw new IllegalArgumentException("maxEvents must be >= 0, got: " + maxEvents);
    }
    if (maxKeys < 1) {
      throw new IllegalArgumentException("maxKeys must be >= 1, got: " + maxKeys);
    }
    this.windowMs = window.toMillis();
    this.maxEvents = maxEvents;
    this.maxKeys = maxKeys;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized boolean allow(String key) {
    Objects.requireNonNull(key, "key");
    long now = clock.millis();
    long cutoff = now - windowMs;

    Deque<Long> timestamps = admissions.get(key);
    if (timestamps != null) {
      expire(timestamps, cutoff);
    }
    int count = timestamps == null ? 0 : timestamps.size();
    if (count >= maxEvents) {
      return false;
    }
    if (timestamps == null) {
      if (admissions.size() >= maxKeys) {
        compact(cutoff);
      }
      timestamps = new ArrayDeque<>();
      admissions.put(key, timestamps);
    }
    timestamps.addLast(now);
    return true;
  }

  /**
   * Returns the number of keys currently tracked.
   */
  public synchronized int trackedKeys() {
    return admissions.size();
  }

  /**
   * Returns the number of admissions still inside the window for {@code key}.
   */
  public synchronized int currentCount(String key) {
    Deque<Long> timestamps = admissions.get(key);
    if (timestamps == null) {
      return 0;
    }
    expire(timestamps, clock.millis() - windowMs);
    return timestamps.size();
  }

  private void compact(long cutoff) {
    Iterator<Deque<Long>> it = admissions.values().iterator();
    while (it.hasNext()) {
      Deque<Long> timestamps = it.next();
      expire(timestamps, cutoff);
      if (timestamps.isEmpty()) {
        it.remove();
      }
    }
  }

  private static void expire(Deque<Long> timestamps, long cutoff) {
    // timestamps are appended under the lock from a monotonic-enough clock; oldest first
    while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
      timestamps.pollFirst();
    }
  }
}
