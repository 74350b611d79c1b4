/**
 * Transport implementations and the backend-ready event form.
 *
 * <p>{@link telemetry.transport.TransportEvent} is what a {@link telemetry.spi.Transport}
 * receives. {@link telemetry.transport.LoggingTransport} writes events to the log;
 * {@link telemetry.transport.DeferredTransport} buffers them until the backend client has been
 * initialized.
 */
package telemetry.transport;
