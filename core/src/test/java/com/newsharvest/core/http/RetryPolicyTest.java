package com.newsharvest.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void only_429_5xx_and_transport_errors_are_retried() {
        var p = RetryPolicy.defaults();
        assertEquals(3, p.maxAttempts());

        for (int sc : new int[]{429, 500, 503, -1}) {
            assertTrue(p.delayAfter(1, sc, null).isPresent(), "retry after first failure for " + sc);
            assertTrue(p.delayAfter(2, sc, null).isPresent(), "retry after second failure for " + sc);
            assertTrue(p.delayAfter(3, sc, null).isEmpty(), "stop at attempt=3 for " + sc);
        }
        for (int sc : new int[]{200, 301, 403, 404}) {
            assertTrue(p.delayAfter(1, sc, null).isEmpty(), "no retry for " + sc);
        }
    }

    @Test
    void backoff_is_exponential_with_jitter_plus_minus_10_percent() {
        var p = RetryPolicy.defaults();
        assertBetween(p.backoff(1), 900, 1100);
        assertBetween(p.backoff(2), 1800, 2200);
        assertBetween(p.backoff(3), 3600, 4400);
    }

    @Test
    void retry_after_wins_when_longer_and_is_capped() {
        var p = new RetryPolicy(3, Duration.ofMillis(500), 0.0, Duration.ofSeconds(30));

        assertEquals(Optional.of(Duration.ofSeconds(5)), p.delayAfter(1, 429, " 5 "));
        assertEquals(Optional.of(Duration.ofMillis(500)), p.delayAfter(1, 429, "0"));
        assertEquals(Optional.of(Duration.ofSeconds(30)), p.delayAfter(1, 429, "3600"));
        // HTTP-date 는 해석하지 않고 백오프만
        assertEquals(Optional.of(Duration.ofMillis(1000)), p.delayAfter(2, 503, "Wed, 21 Oct 2015 07:28:00 GMT"));
    }

    @Test
    void never_does_not_retry() {
        assertTrue(RetryPolicy.NEVER.delayAfter(1, 503, "1").isEmpty());
    }

    @Test
    void invalid_settings_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 0.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, Duration.ofSeconds(1), 1.5, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, null, 0.1, Duration.ZERO));
    }

    private static void assertBetween(Duration d, long min, long max) {
        long ms = d.toMillis();
        assertTrue(ms >= min && ms <= max, () -> "out of range: " + ms + "ms (expected " + min + "~" + max + ")");
    }
}
