package org.example.insights.config;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenBucketSendRateLimiterTest {

    @Test
    void acquire_allowsBurstUpToRateThenBlocksForNextPermit() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        List<Long> sleeps = new ArrayList<>();
        TokenBucketSendRateLimiter limiter = new TokenBucketSendRateLimiter(5, clock, millis -> {
            sleeps.add(millis);
            clock.advanceMillis(millis);
        });

        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        assertTrue(sleeps.isEmpty());

        limiter.acquire();
        assertEquals(List.of(200L), sleeps);
    }

    @Test
    void acquire_neverExceedsRateWithinOneSecond() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        TokenBucketSendRateLimiter limiter = new TokenBucketSendRateLimiter(5, clock, clock::advanceMillis);
        Instant start = clock.instant();

        for (int i = 0; i < 15; i++) {
            limiter.acquire();
        }

        // 5 immediately, then one every 200 ms
        assertEquals(2000, clock.instant().toEpochMilli() - start.toEpochMilli());
    }

    @Test
    void tryAcquire_refusesWhenEmptyAndRefillsOverTime() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        TokenBucketSendRateLimiter limiter = new TokenBucketSendRateLimiter(2, clock, millis -> { });

        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());

        clock.advanceMillis(500);
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void constructor_clampsRateToAtLeastOne() {
        TokenBucketSendRateLimiter limiter = new TokenBucketSendRateLimiter(0);
        assertEquals(1, limiter.getPermitsPerSecond());
    }

    private static final class MutableClock extends Clock {
        private Instant current;

        private MutableClock(Instant current) {
            this.current = current;
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }

        private void advanceMillis(long millis) {
            current = current.plusMillis(millis);
        }
    }
}
