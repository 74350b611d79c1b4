package telemetry;

import java.util.Map;

/**
 * Capability of an error that carries additional diagnostic context.
 *
 * <p>String values are scrubbed before they leave the process; other values are forwarded
 * as-is and must not hold sensitive data.
 *
 * @see ErrorEvents#from(Throwable, String)
 */
public interface ContextAware {

  /**
   * Returns the diagnostic context; never {@code null}.
   */
  Map<String, Object> context();
}
