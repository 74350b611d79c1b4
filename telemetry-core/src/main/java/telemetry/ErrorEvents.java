package telemetry;

import java.util.Objects;

/**
 * Converts throwables into {@link ErrorEvent}s.
 *
 * <p>Component, category, and context are read from the {@link ComponentAware} and
 * {@link ContextAware} capabilities when the throwable (or, failing that, one of its causes)
 * has them. Otherwise the supplied default component and {@link ErrorCategory#GENERIC} are used.
 */
public final class ErrorEvents {

  private ErrorEvents() {}

  /**
   * Builds an event for {@code error}.
   *
   * @param error            the error to convert
   * @param defaultComponent component used when the error does not name one
   * @return a new, unreported event
   */
  public static ErrorEvent from(Throwable error, String defaultComponent) {
    Objects.requireNonNull(error, "error");
    ErrorEvent.Builder builder = ErrorEvent.builder(error).component(defaultComponent);

    ComponentAware componentAware = findCapability(error, ComponentAware.class);
    if (componentAware != null) {
      builder.component(componentAware.component()).category(componentAware.category());
    }
    ContextAware contextAware = findCapability(error, ContextAware.class);
    if (contextAware != null) {
      builder.context(contextAware.context());
    }
    return builder.build();
  }

  /**
   * Builds an event for {@code error} with {@link ErrorEvent#UNKNOWN_COMPONENT} as default.
   */
  public static ErrorEvent from(Throwable error) {
    return from(error, ErrorEvent.UNKNOWN_COMPONENT);
  }

  private static <T> T findCapability(Throwable error, Class<T> capability) {
    Throwable current = error;
    // bounded walk; cause chains can be cyclic
    for (int depth = 0; current != null && depth < 16; depth++) {
      if (capability.isInstance(current)) {
        return capability.cast(current);
      }
      current = current.getCause();
    }
    return null;
  }
}
