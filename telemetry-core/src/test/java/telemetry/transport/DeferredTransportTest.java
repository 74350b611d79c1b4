package telemetry.transport;

import org.junit.jupiter.api.Test;
import telemetry.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeferredTransportTest {

    private static TransportEvent event(String id) {
        return new TransportEvent(id, "Title", "[generic] msg", Severity.ERROR,
                Map.of(), Map.of(), List.of("Title"), Instant.EPOCH);
    }

    private static List<String> ids(List<TransportEvent> events) {
        return events.stream().map(TransportEvent::eventId).collect(Collectors.toList());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new DeferredTransport(0));
    }

    @Test
    void buffersUntilAttachedThenReplaysInOrder() throws Exception {
        DeferredTransport deferred = new DeferredTransport(10);
        deferred.send(event("1"));
        deferred.send(event("2"));
        assertFalse(deferred.isAttached());
        assertEquals(2, deferred.pendingCount());
        assertFalse(deferred.flush(Duration.ofMillis(10)));

        RecordingTransport backend = new RecordingTransport();
        assertEquals(2, deferred.attach(backend));
        deferred.send(event("3"));

        assertTrue(deferred.isAttached());
        assertEquals(0, deferred.pendingCount());
        assertEquals(List.of("1", "2", "3"), ids(backend.sent()));
        assertTrue(deferred.flush(Duration.ofMillis(10)));
    }

    @Test
    void discardsOldestWhenFull() throws Exception {
        DeferredTransport deferred = new DeferredTransport(2);
        deferred.send(event("1"));
        deferred.send(event("2"));
        deferred.send(event("3"));

        assertEquals(2, deferred.pendingCount());
        assertEquals(1, deferred.discardedCount());

        RecordingTransport backend = new RecordingTransport();
        deferred.attach(backend);
        assertEquals(List.of("2", "3"), ids(backend.sent()));
    }

    @Test
    void replayFailuresAreSkipped() {
        DeferredTransport deferred = new DeferredTransport(5);
        assertDoesNotThrowSend(deferred, event("1"));
        assertDoesNotThrowSend(deferred, event("2"));

        RecordingTransport backend = new RecordingTransport().failing(true);
        assertEquals(0, deferred.attach(backend));
        assertEquals(2, backend.attempts());
        assertEquals(0, deferred.pendingCount());
    }

    @Test
    void attachTwiceFails() {
        DeferredTransport deferred = new DeferredTransport();
        deferred.attach(new RecordingTransport());
        assertThrows(IllegalStateException.class, () -> deferred.attach(new RecordingTransport()));
    }

    @Test
    void loggingTransportAlwaysFlushes() {
        LoggingTransport logging = new LoggingTransport();
        logging.send(event("1"));
        assertTrue(logging.flush(Duration.ZERO));
    }

    private static void assertDoesNotThrowSend(DeferredTransport transport, TransportEvent event) {
        try {
            transport.send(event);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
