package telemetry.worker;

import telemetry.ErrorCategory;
import telemetry.ErrorEvent;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects errors caused by the user's environment rather than by a code defect.
 *
 * <p>Currently this covers MQTT broker authentication failures: a wrong password produces a
 * steady stream of identical errors that nobody reading the backend can fix.
 */
public final class OperationalErrorFilter implements EventFilter {
  public static final OperationalErrorFilter INSTANCE = new OperationalErrorFilter();

  private static final Set<String> MQTT_CATEGORIES = Set.of(
      ErrorCategory.MQTT_CONNECTION.value(),
      ErrorCategory.MQTT_AUTH.value());

  private static final List<String> AUTH_PATTERNS = List.of(
      "not authorized",
      "authentication failed",
      "bad username or password",
      "bad user name or password",
      "access denied",
      "unauthorized");

  private OperationalErrorFilter() {
  }

  @Override
  public boolean shouldReport(ErrorEvent event) {
    if (!MQTT_CATEGORIES.contains(event.category())) {
      return true;
    }
    String message = event.message().toLowerCase(Locale.ROOT);
    for (String pattern : AUTH_PATTERNS) {
      if (message.contains(pattern)) {
        return false;
      }
    }
    return true;
  }
}
