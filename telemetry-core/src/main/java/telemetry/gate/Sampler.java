package telemetry.gate;

/**
 * Decides whether an event from a given {@code (component, category)} pair is forwarded.
 *
 * @see DeterministicSampler
 */
public interface Sampler {

  /**
   * Returns whether an event should be kept at the given sampling rate.
   *
   * @param component the component that raised the event
   * @param category  the event category
   * @param rate      fraction of events to keep, in [0, 1]
   * @return {@code true} to keep the event
   */
  boolean shouldSample(String component, String category, double rate);
}
