package telemetry.transport;

import telemetry.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The scrubbed, backend-ready form of an {@link telemetry.ErrorEvent}.
 *
 * <p>Every string in here has already passed through
 * {@link telemetry.privacy.PrivacyScrubber#scrubMessage(String)}; transports may log or ship it
 * as is.
 *
 * @param eventId     id of the source event
 * @param title       short grouping title, e.g. {@code "Datastore Database Error Save Detection"}
 * @param message     {@code "[category] <scrubbed message>"}
 * @param severity    level derived from the category
 * @param tags        low-cardinality tags: {@code component}, {@code category},
 *                    {@code error_type}, {@code error_title}
 * @param contexts    scrubbed context values by key
 * @param fingerprint grouping key: title, component, category
 * @param timestamp   creation time of the source event
 */
public record TransportEvent(
    String eventId,
    String title,
    String message,
    Severity severity,
    Map<String, String> tags,
    Map<String, Object> contexts,
    List<String> fingerprint,
    Instant timestamp) {

  public TransportEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(timestamp, "timestamp");
    tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    contexts = Collections.unmodifiableMap(new LinkedHashMap<>(contexts));
    fingerprint = List.copyOf(fingerprint);
  }
}
