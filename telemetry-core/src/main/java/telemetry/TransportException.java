package telemetry;

/**
 * Signals that the telemetry backend could not accept an event.
 *
 * <p>Thrown by {@link telemetry.spi.Transport#send} and propagated by
 * {@link EventConsumer#processEvent} so the event bus can log the failure. It never reaches the
 * code that originally produced the error.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
