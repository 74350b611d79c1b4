package telemetry;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An error or diagnostic event travelling from the code that produced it to the telemetry backend.
 *
 * <p>All fields are immutable except the {@linkplain #isReported() reported} flag, which moves
 * from {@code false} to {@code true} at most once and never resets. Consumers use it to make
 * repeated delivery of the same instance a no-op.
 *
 * <p>Each event is assigned a ULID-based {@code eventId}. Use the {@linkplain Builder builder}
 * or {@link #of(Throwable)} to create instances; {@link ErrorEvents} converts arbitrary
 * throwables using their {@link ComponentAware}/{@link ContextAware} capabilities.
 *
 * @see EventConsumer
 * @see ErrorEvents
 */
public final class ErrorEvent {
    public static final String UNKNOWN_COMPONENT = "unknown";

    private final String eventId;
    private final Throwable error;
    private final String message;
    private final String component;
    private final String category;
    private final Map<String, Object> context;
    private final Instant timestamp;
    private final AtomicBoolean reported;

    private ErrorEvent(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.error = builder.error;
        if (builder.message != null) {
            this.message = builder.message;
        } else if (builder.error != null) {
            this.message = builder.error.getMessage() != null
                    ? builder.error.getMessage() : builder.error.getClass().getName();
        } else {
            throw new IllegalArgumentException("message or error must be set");
        }
        this.component = builder.component == null || builder.component.isBlank()
                ? UNKNOWN_COMPONENT : builder.component;
        this.category = builder.category == null || builder.category.isBlank()
                ? ErrorCategory.GENERIC.value() : builder.category;

        Map<String, Object> contextCopy = builder.context == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
        if (contextCopy.containsKey(null)) {
            throw new IllegalArgumentException("context cannot contain null keys");
        }
        this.context = contextCopy;
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.reported = new AtomicBoolean(builder.reported);
    }

    /**
     * Creates a builder for an event with a plain message.
     *
     * @param message the error message
     * @return a new builder
     */
    public static Builder builder(String message) {
        return new Builder().message(Objects.requireNonNull(message, "message"));
    }

    /**
     * Creates a builder for an event wrapping a throwable.
     *
     * @param error the underlying error
     * @return a new builder
     */
    public static Builder builder(Throwable error) {
        return new Builder().error(Objects.requireNonNull(error, "error"));
    }

    /**
     * Creates an event for a throwable with default component and category.
     *
     * @param error the underlying error
     * @return a new event
     */
    public static ErrorEvent of(Throwable error) {
        return builder(error).build();
    }

    public String eventId() {
        return eventId;
    }

    /**
     * Returns the underlying error, or {@code null} for message-only events.
     */
    public Throwable error() {
        return error;
    }

    public String message() {
        return message;
    }

    public String component() {
        return component;
    }

    public String category() {
        return category;
    }

    public Map<String, Object> context() {
        return context;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public boolean isReported() {
        return reported.get();
    }

    /**
     * Marks this event as reported.
     *
     * @return {@code true} if this call performed the transition, {@code false} if the event
     *     was already reported
     */
    public boolean markReported() {
        return reported.compareAndSet(false, true);
    }

    /**
     * Returns a short type name of the underlying error for tagging, or {@code "message"} for
     * message-only events.
     */
    public String errorType() {
        return error == null ? "message" : error.getClass().getName();
    }

    @Override
    public String toString() {
        // message omitted, it may hold unscrubbed text
        return "ErrorEvent{eventId=" + eventId
                + ", component=" + component
                + ", category=" + category
                + ", timestamp=" + timestamp
                + ", reported=" + reported.get()
                + '}';
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    /** Builder for {@link ErrorEvent}. */
    public static final class Builder {
        private String eventId;
        private Throwable error;
        private String message;
        private String component;
        private String category;
        private Map<String, Object> context;
        private Instant timestamp;
        private boolean reported;

        private Builder() {}

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        /**
         * Overrides the message; defaults to the error's message.
         */
        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder category(ErrorCategory category) {
            this.category = category == null ? null : category.value();
            return this;
        }

        public Builder context(Map<String, ?> context) {
            this.context = context == null ? null : new LinkedHashMap<>(context);
            return this;
        }

        /**
         * Adds a single context entry.
         */
        public Builder context(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (this.context == null) {
                this.context = new LinkedHashMap<>();
            }
            this.context.put(key, value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Creates the event already in the reported state. Mostly useful for tests and for
         * events replayed from another reporter.
         */
        public Builder reported(boolean reported) {
            this.reported = reported;
            return this;
        }

        public ErrorEvent build() {
            return new ErrorEvent(this);
        }
    }
}
