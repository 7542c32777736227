package com.sanctionsentinel.service.download;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {
    @Test
    void delaysDoubleUntilCapped() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(2), Duration.ofSeconds(10), 0);

        assertEquals(Duration.ofSeconds(2), policy.delayBefore(1, () -> 0.5));
        assertEquals(Duration.ofSeconds(4), policy.delayBefore(2, () -> 0.5));
        assertEquals(Duration.ofSeconds(8), policy.delayBefore(3, () -> 0.5));
        assertEquals(Duration.ofSeconds(10), policy.delayBefore(4, () -> 0.5));
        assertEquals(Duration.ofSeconds(10), policy.delayBefore(9, () -> 0.5));
    }

    @Test
    void jitterStaysWithinRatioAndCap() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(10), Duration.ofSeconds(60), 0.2);

        assertEquals(Duration.ofSeconds(8), policy.delayBefore(1, () -> 0.0));
        assertEquals(Duration.ofSeconds(10), policy.delayBefore(1, () -> 0.5));
        Duration high = policy.delayBefore(1, () -> 0.999);
        assertTrue(high.compareTo(Duration.ofSeconds(12)) <= 0);
        assertTrue(high.compareTo(Duration.ofSeconds(11)) > 0);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.5));
    }

    @Test
    void cappedNeverExceedsMaxDelay() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(Duration.ofMinutes(2), policy.capped(Duration.ofHours(1)));
        assertEquals(Duration.ofSeconds(5), policy.capped(Duration.ofSeconds(5)));
    }
}
