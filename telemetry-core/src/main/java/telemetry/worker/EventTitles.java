package telemetry.worker;

import telemetry.ErrorCategory;
import telemetry.ErrorEvent;
import telemetry.privacy.PrivacyScrubber;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the grouping title of an event from its component, category and {@code operation}
 * context entry, e.g. {@code "Datastore Database Error Save Detection"}.
 *
 * <p>The title never includes the raw message. Falls back to the error type when nothing else
 * is known.
 */
final class EventTitles {
  static final String OPERATION_KEY = "operation";

  private EventTitles() {
  }

  static String titleOf(ErrorEvent event) {
    List<String> parts = new ArrayList<>(3);

    String component = event.component();
    if (!component.isEmpty() && !ErrorEvent.UNKNOWN_COMPONENT.equals(component)) {
      parts.add(capitalize(component));
    }
    String category = ErrorCategory.titleOf(event.category());
    if (!category.isEmpty()) {
      parts.add(category);
    }
    if (event.context().get(OPERATION_KEY) instanceof String operation && !operation.isBlank()) {
      String formatted = formatOperation(PrivacyScrubber.scrubMessage(operation));
      if (!formatted.isEmpty()) {
        parts.add(formatted);
      }
    }

    if (parts.isEmpty()) {
      return event.errorType();
    }
    return String.join(" ", parts);
  }

  static String formatOperation(String operation) {
    String[] words = operation.replace('_', ' ').trim().split("\\s+");
    List<String> out = new ArrayList<>(words.length);
    for (String word : words) {
      if (!word.isEmpty()) {
        out.add(capitalize(word));
      }
    }
    return String.join(" ", out);
  }

  private static String capitalize(String value) {
    if (value.isEmpty()) {
      return value;
    }
    return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
  }
}
