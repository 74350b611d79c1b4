package telemetry;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Well-known error categories.
 *
 * <p>Each constant carries its wire {@linkplain #value() value} (the string stored in
 * {@link ErrorEvent#category()}), a human-readable {@linkplain #title() title} used when building
 * diagnostic titles, and the {@linkplain #severity() severity} reported to the backend.
 * Categories outside this enum are carried as plain strings and reported at {@link Severity#ERROR}.
 */
public enum ErrorCategory {
  MODEL_INIT("model-initialization", "Model Initialization Error", Severity.ERROR),
  MODEL_LOAD("model-loading", "Model Loading Error", Severity.ERROR),
  LABEL_LOAD("label-loading", null, Severity.ERROR),
  VALIDATION("validation", "Validation Error", Severity.ERROR),
  FILE_IO("file-io", "File I/O Error", Severity.WARNING),
  NETWORK("network", "Network Error", Severity.WARNING),
  AUDIO("audio-processing", null, Severity.WARNING),
  RTSP("rtsp-connection", null, Severity.WARNING),
  DATABASE("database", "Database Error", Severity.ERROR),
  HTTP("http-request", null, Severity.WARNING),
  CONFIGURATION("configuration", "Configuration Error", Severity.ERROR),
  SYSTEM("system-resource", "System Error", Severity.ERROR),
  MQTT_CONNECTION("mqtt-connection", null, Severity.ERROR),
  MQTT_PUBLISH("mqtt-publish", null, Severity.ERROR),
  MQTT_AUTH("mqtt-authentication", null, Severity.ERROR),
  IMAGE_FETCH("image-fetch", "Image Fetch Error", Severity.ERROR),
  IMAGE_CACHE("image-cache", "Image Cache Error", Severity.ERROR),
  IMAGE_PROVIDER("image-provider", "Image Provider Error", Severity.ERROR),
  NOT_FOUND("not-found", null, Severity.INFO),
  TIMEOUT("timeout", null, Severity.ERROR),
  INTEGRATION("integration", null, Severity.ERROR),
  GENERIC("generic", null, Severity.ERROR);

  private static final Map<String, ErrorCategory> BY_VALUE = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCategory::value, Function.identity()));

  private final String value;
  private final String title;
  private final Severity severity;

  ErrorCategory(String value, String title, Severity severity) {
    this.value = value;
    this.title = title == null ? value : title;
    this.severity = severity;
  }

  public String value() {
    return value;
  }

  public String title() {
    return title;
  }

  public Severity severity() {
    return severity;
  }

  /**
   * Looks up a category by its wire value.
   *
   * @param value the wire value, e.g. {@code "network"}
   * @return the matching category, or empty for unknown or {@code null} values
   */
  public static Optional<ErrorCategory> fromValue(String value) {
    return value == null ? Optional.empty() : Optional.ofNullable(BY_VALUE.get(value));
  }

  /**
   * Returns the title for a category string, falling back to the string itself.
   */
  public static String titleOf(String category) {
    return fromValue(category).map(ErrorCategory::title).orElse(category == null ? "" : category);
  }

  /**
   * Returns the severity for a category string; unknown categories map to {@link Severity#ERROR}.
   */
  public static Severity severityOf(String category) {
    return fromValue(category).map(ErrorCategory::severity).orElse(Severity.ERROR);
  }
}
