package telemetry.gate;

import org.junit.jupiter.api.Test;
import telemetry.util.ConcurrentRunner;
import telemetry.util.MutableClock;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void admitsUpToMaxWithinWindow() {
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(Duration.ofSeconds(1), 5, 16, clock);

        int allowed = 0;
        for (int i = 0; i < 20; i++) {
            if (limiter.allow("k")) allowed++;
        }
        assertEquals(5, allowed);
        assertEquals(5, limiter.currentCount("k"));
    }

    @Test
    void windowSlidesPastOldAdmissions() {
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(Duration.ofSeconds(1), 2, 16, clock);
        assertTrue(limiter.allow("k"));
        clock.advanceMillis(500);
        assertTrue(limiter.allow("k"));
        assertFalse(limiter.allow("k"));

        // first admission leaves the window exactly at now - window
        clock.advanceMillis(500);
        assertTrue(limiter.allow("k"));
        assertFalse(limiter.allow("k"));
    }

    @Test
    void keysAreIndependent() {
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(Duration.ofSeconds(1), 1, 16, clock);
        assertTrue(limiter.allow("a"));
        assertFalse(limiter.allow("a"));
        assertTrue(limiter.allow("b"));
        assertEquals(2, limiter.trackedKeys());
    }

    @Test
    void concurrentCallersNeverExceedMaxPerKey() throws Exception {
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(Duration.ofMinutes(5), 50, 16, clock);
        String[] keys = {"camera", "datastore", "audio", "weather"};
        AtomicInteger[] admitted = new AtomicInteger[keys.length];
        for (int k = 0; k < keys.length; k++) {
            admitted[k] = new AtomicInteger();
        }

        List<Throwable> failures = ConcurrentRunner.run(16, t -> {
            int k = t % keys.length;
            for (int i = 0; i < 500; i++) {
                if (limiter.allow(keys[k])) admitted[k].incrementAndGet();
            }
        });

        assertEquals(List.of(), failures);
        for (int k = 0; k < keys.length; k++) {
            assertEquals(50, admitted[k].get(), keys[k]);
            assertEquals(50, limiter.currentCount(keys[k]));
        }
    }

    @Test
    void zeroMaxAdmitsNothing() {
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(Duration.ofSeconds(1), 0, 16, clock);
        assertFalse(limiter.allow("k"));
        assertEquals(0, limiter.trackedKeys());
    }

    @Test
    void idleKeysAreCompactedAtKeyBound() {
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(Duration.ofSeconds(1), 1, 2, clock);
        assertTrue(limiter.allow("a"));
        assertTrue(limiter.allow("b"));
        clock.advanceMillis(1_500);

        assertTrue(limiter.allow("c"));
        assertEquals(1, limiter.trackedKeys());
    }

    @Test
    void activeKeysSurviveCompaction() {
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(Duration.ofSeconds(1), 1, 2, clock);
        assertTrue(limiter.allow("a"));
        assertTrue(limiter.allow("b"));
        assertTrue(limiter.allow("c"));

        assertEquals(3, limiter.trackedKeys());
        assertFalse(limiter.allow("a"));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(Duration.ofSeconds(1), -1));
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(Duration.ofSeconds(1), 1, 0, clock));
        assertThrows(NullPointerException.class,
                () -> new SlidingWindowRateLimiter(null, 1));
    }

    @Test
    void recoversWithRealClock() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(Duration.ofSeconds(1), 5);
        int allowed = 0;
        for (int i = 0; i < 20; i++) {
            if (limiter.allow("component")) allowed++;
        }
        assertEquals(5, allowed);

        Thread.sleep(1_100);
        allowed = 0;
        for (int i = 0; i < 20; i++) {
            if (limiter.allow("component")) allowed++;
        }
        assertEquals(5, allowed);
    }
}
