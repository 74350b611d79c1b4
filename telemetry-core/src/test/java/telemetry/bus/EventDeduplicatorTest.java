package telemetry.bus;

import org.junit.jupiter.api.Test;
import telemetry.ErrorCategory;
import telemetry.ErrorEvent;
import telemetry.util.MutableClock;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventDeduplicatorTest {

    private final MutableClock clock = new MutableClock();

    private static ErrorEvent event(String component, String message) {
        return ErrorEvent.builder(message).component(component).category(ErrorCategory.DATABASE).build();
    }

    @Test
    void repeatInsideTtlIsDuplicate() {
        EventDeduplicator dedup = new EventDeduplicator(Duration.ofMinutes(5), 100, clock);

        assertTrue(dedup.tryAcquire(event("datastore", "insert failed")));
        clock.advance(Duration.ofMinutes(4));
        assertFalse(dedup.tryAcquire(event("datastore", "insert failed")));
        assertEquals(1, dedup.size());
    }

    @Test
    void repeatAfterTtlIsAcceptedAgain() {
        EventDeduplicator dedup = new EventDeduplicator(Duration.ofMinutes(5), 100, clock);

        assertTrue(dedup.tryAcquire(event("datastore", "insert failed")));
        clock.advance(Duration.ofMinutes(2));
        assertFalse(dedup.tryAcquire(event("datastore", "insert failed")));

        // the window is measured from the first occurrence, not the last repeat
        clock.advance(Duration.ofMinutes(3));
        assertTrue(dedup.tryAcquire(event("datastore", "insert failed")));
        assertFalse(dedup.tryAcquire(event("datastore", "insert failed")));
    }

    @Test
    void componentCategoryAndMessageAllDistinguishEvents() {
        EventDeduplicator dedup = new EventDeduplicator(Duration.ofMinutes(5), 100, clock);

        assertTrue(dedup.tryAcquire(event("datastore", "insert failed")));
        assertTrue(dedup.tryAcquire(event("camera", "insert failed")));
        assertTrue(dedup.tryAcquire(event("datastore", "update failed")));
        assertTrue(dedup.tryAcquire(ErrorEvent.builder("insert failed")
                .component("datastore").category(ErrorCategory.NETWORK).build()));
        assertEquals(4, dedup.size());
    }

    @Test
    void fingerprintIgnoresEventIdAndTimestamp() {
        ErrorEvent a = event("datastore", "insert failed");
        ErrorEvent b = event("datastore", "insert failed");

        assertNotEquals(a.eventId(), b.eventId());
        assertEquals(EventDeduplicator.fingerprint(a), EventDeduplicator.fingerprint(b));
        assertFalse(EventDeduplicator.fingerprint(a).contains("insert"));
    }

    @Test
    void oldestEntryIsForgottenAtCapacity() {
        EventDeduplicator dedup = new EventDeduplicator(Duration.ofMinutes(5), 2, clock);

        assertTrue(dedup.tryAcquire(event("a", "x")));
        assertTrue(dedup.tryAcquire(event("b", "x")));
        assertTrue(dedup.tryAcquire(event("c", "x")));

        assertEquals(2, dedup.size());
        assertTrue(dedup.tryAcquire(event("a", "x")));
        assertFalse(dedup.tryAcquire(event("c", "x")));
    }

    @Test
    void expiredEntriesArePurged() {
        EventDeduplicator dedup = new EventDeduplicator(Duration.ofSeconds(10), 100, clock);
        for (int i = 0; i < 5; i++) {
            dedup.tryAcquire(event("datastore", "failure " + i));
        }
        clock.advance(Duration.ofSeconds(10));

        dedup.tryAcquire(event("datastore", "fresh"));
        assertEquals(1, dedup.size());
    }

    @Test
    void releaseForgetsEvent() {
        EventDeduplicator dedup = new EventDeduplicator(Duration.ofMinutes(5), 100, clock);
        ErrorEvent event = event("datastore", "insert failed");

        assertTrue(dedup.tryAcquire(event));
        dedup.release(event);
        assertTrue(dedup.tryAcquire(event));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new EventDeduplicator(Duration.ZERO, 10, clock));
        assertThrows(IllegalArgumentException.class, () -> new EventDeduplicator(Duration.ofSeconds(1), 0, clock));
        assertThrows(NullPointerException.class, () -> new EventDeduplicator(null, 10, clock));
        assertThrows(NullPointerException.class, () -> new EventDeduplicator(Duration.ofSeconds(1), 10, null));
    }
}
