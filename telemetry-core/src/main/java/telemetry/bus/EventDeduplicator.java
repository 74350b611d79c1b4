package telemetry.bus;

import telemetry.ErrorEvent;
import telemetry.util.Hashes;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Time-bounded memory of recently published events, used by {@link AsyncEventBus} to suppress
 * repeats of the same error.
 *
 * <p>Events are identified by a SHA-256 fingerprint of component, category and message; the
 * event id and timestamp are ignored. The first occurrence opens a window of {@code ttl}, and
 * identical events inside that window are duplicates. A repeat does not extend the window.
 *
 * <p>At most {@code maxEntries} fingerprints are kept. Expired fingerprints are purged on every
 * call; when the bound is still reached the oldest fingerprint is forgotten.
 *
 * <p>This class is thread-safe.
 */
public final class EventDeduplicator {
  private static final int FINGERPRINT_BYTES = 16;

  private final long ttlMs;
  private final int maxEntries;
  private final Clock clock;
  // insertion order is first-seen order
  private final Map<String, Long> firstSeen = new LinkedHashMap<>();

  /**
   * @param ttl        how long a fingerprint suppresses repeats (&gt; 0)
   * @param maxEntries maximum number of remembered fingerprints (&ge; 1)
   * @param clock      time source
   */
  public EventDeduplicator(Duration ttl, int maxEntries, Clock clock) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be > 0, got: " + ttl);
    }
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1, got: " + maxEntries);
    }
    this.ttlMs = ttl.toMillis();
    this.maxEntries = maxEntries;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records the event unless an identical one was recorded within the TTL.
   *
   * @return {@code true} if the event is new, {@code false} if it is a duplicate
   */
  public boolean tryAcquire(ErrorEvent event) {
    String key = fingerprint(event);
    synchronized (this) {
      long now = clock.millis();
      purgeExpired(now);
      Long seenAt = firstSeen.get(key);
      if (seenAt != null && now - seenAt < ttlMs) {
        return false;
      }
      firstSeen.remove(key);
      if (firstSeen.size() >= maxEntries) {
        Iterator<String> oldest = firstSeen.keySet().iterator();
        oldest.next();
        oldest.remove();
      }
      firstSeen.put(key, now);
      return true;
    }
  }

  /**
   * Forgets the event, so the next identical event is accepted. Used when an acquired event could
   * not be queued after all.
   */
  public void release(ErrorEvent event) {
    String key = fingerprint(event);
    synchronized (this) {
      firstSeen.remove(key);
    }
  }

  public synchronized int size() {
    return firstSeen.size();
  }

  static String fingerprint(ErrorEvent event) {
    return Hashes.sha256Hex(event.component() + '\u0000' + event.category() + '\u0000' + event.message(),
        FINGERPRINT_BYTES);
  }

  private void purgeExpired(long now) {
    Iterator<Long> it = firstSeen.values().iterator();
    while (it.hasNext()) {
      if (now - it.next() < ttlMs) {
        break;
      }
      it.remove();
    }
  }
}
