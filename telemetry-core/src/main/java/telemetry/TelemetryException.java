package telemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime exception that carries its own component, category, and diagnostic context, so it
 * converts into a fully populated {@link ErrorEvent} without further input.
 *
 * <pre>{@code
 * throw new TelemetryException("datastore", ErrorCategory.DATABASE, "insert failed", cause)
 *     .with("operation", "save_detection");
 * }</pre>
 */
public class TelemetryException extends RuntimeException implements ComponentAware, ContextAware {

    private final String component;
    private final String category;
    private final Map<String, Object> context = new LinkedHashMap<>();

    public TelemetryException(String component, ErrorCategory category, String message) {
        this(component, category, message, null);
    }

    public TelemetryException(String component, ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.component = Objects.requireNonNull(component, "component");
        this.category = Objects.requireNonNull(category, "category").value();
    }

    /**
     * Adds a context entry and returns this exception for chaining.
     *
     * @param key   context key
     * @param value context value
     * @return this exception
     */
    public TelemetryException with(String key, Object value) {
        context.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    @Override
    public String component() {
        return component;
    }

    @Override
    public String category() {
        return category;
    }

    @Override
    public Map<String, Object> context() {
        return Collections.unmodifiableMap(context);
    }
}
