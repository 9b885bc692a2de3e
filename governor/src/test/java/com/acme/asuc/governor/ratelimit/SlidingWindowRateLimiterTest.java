package com.acme.asuc.governor.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowRateLimiterTest {
    private static final long MS = 1_000_000L;
    private static final long WINDOW = 10_000L * MS;

    private final SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter("test", new RateLimitPolicy(5, Duration.ofSeconds(10)));

    @Test
    void shouldApproveFiftyOfFiftyOneRapidRequests() {
        long now = 1_000L * MS;
        int approved = 0;
        int denied = 0;
        for (int i = 0; i < 51; i++) {
            if (limiter.allow(null, now + i * MS)) {
                approved++;
            } else {
                denied++;
            }
        }
        assertEquals(50, approved);
        assertEquals(1, denied);
        assertEquals(1L, limiter.rejectedCount());

        assertTrue(limiter.allow(null, now + 50 * MS + WINDOW));
    }

    @Test
    void shouldLimitOneComponentToMaxPerSecondInsideWindow() {
        long now = 0L;
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.allow("feeds", now + i * MS));
        }
        assertFalse(limiter.allow("feeds", now + 5 * MS));
        assertTrue(limiter.allow("panel", now + 6 * MS));
        assertEquals(5, limiter.recentCountFor("feeds", now + 6 * MS));
    }

    @Test
    void shouldExpireRecordsExactlyAtWindowAge() {
        long start = 5L * MS;
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.allow("feeds", start));
        }
        assertFalse(limiter.allow("feeds", start + WINDOW - 1));
        assertTrue(limiter.allow("feeds", start + WINDOW));
        assertEquals(1, limiter.recentCount(start + WINDOW));
    }

    @Test
    void shouldNeverRetainRecordsOlderThanWindow() {
        long now = 0L;
        for (int i = 0; i < 200; i++) {
            now += 700L * MS;
            limiter.allow(i % 3 == 0 ? null : "c" + (i % 4), now);
            assertTrue(limiter.oldestAgeNanos(now) < WINDOW);
        }
    }

    @Test
    void shouldForgetEverythingOnClear() {
        for (int i = 0; i < 5; i++) {
            limiter.allow("feeds", 0L);
        }
        limiter.allow("feeds", 0L);
        limiter.clear();
        assertEquals(0, limiter.recentCount(0L));
        assertEquals(0L, limiter.rejectedCount());
        assertTrue(limiter.allow("feeds", 0L));
    }

    @Test
    void shouldCheckWithoutRecording() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.wouldAllow("feeds", 0L));
        }
        assertEquals(0, limiter.recentCountFor("feeds", 0L));

        for (int i = 0; i < 5; i++) {
            limiter.record("feeds", i * MS);
        }
        assertFalse(limiter.wouldAllow("feeds", 5 * MS));
        assertEquals(1L, limiter.rejectedCount());
        assertTrue(limiter.wouldAllow("feeds", WINDOW));
    }

    @Test
    void shouldRejectInvalidPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(1, Duration.ZERO));
    }
}
