package telemetry.gate;

import telemetry.util.Hashes;

/**
 * Sampler that gives every {@code (component, category)} pair a fixed bucket in [0, 99].
 *
 * <p>The bucket is the first four bytes of {@code SHA-256(component + category)}, read as an
 * unsigned integer, modulo 100. An event is kept iff its bucket is below {@code rate * 100}, so a
 * recurring failure is either always reported or always dropped at a given rate instead of
 * flickering in and out of the backend. Across many distinct pairs the kept fraction converges
 * to {@code rate}.
 *
 * <p>Stateless and thread-safe.
 */
public final class DeterministicSampler implements Sampler {
  public static final DeterministicSampler INSTANCE = new DeterministicSampler();

  private static final int BUCKETS = 100;

  @Override
  public boolean shouldSample(String component, String category, double rate) {
    if (rate >= 1.0) {
      return true;
    }
    return bucket(component, category) < rate * BUCKETS;
  }

  /**
   * Returns the stable bucket in [0, 99] for a pair.
   */
  public int bucket(String component, String category) {
    byte[] digest = Hashes.sha256(nullToEmpty(component) + nullToEmpty(category));
    long value = ((digest[0] & 0xFFL) << 24)
        | ((digest[1] & 0xFFL) << 16)
        | ((digest[2] & 0xFFL) << 8)
        | (digest[3] & 0xFFL);
    return (int) (value % BUCKETS);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
