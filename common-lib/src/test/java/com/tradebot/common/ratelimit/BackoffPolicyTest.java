package com.tradebot.common.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Nested
    @DisplayName("delayFor()")
    class DelayTests {

        @Test
        @DisplayName("ORDER schedule → 300ms, 450ms, 675ms")
        void orderSchedule() {
            assertEquals(Duration.ofMillis(300), BackoffPolicy.ORDER.delayFor(1));
            assertEquals(Duration.ofMillis(450), BackoffPolicy.ORDER.delayFor(2));
            assertEquals(Duration.ofMillis(675), BackoffPolicy.ORDER.delayFor(3));
        }

        @Test
        @DisplayName("REST first denial waits 200ms")
        void restFirstDelay() {
            assertEquals(Duration.ofMillis(200), BackoffPolicy.REST.delayFor(1));
        }

        @Test
        @DisplayName("exchange rejection doubles from 2s and stops at 16s")
        void rejectionSchedule() {
            BackoffPolicy p = BackoffPolicy.EXCHANGE_REJECTION;
            assertEquals(Duration.ofSeconds(2),  p.delayFor(1));
            assertEquals(Duration.ofSeconds(4),  p.delayFor(2));
            assertEquals(Duration.ofSeconds(8),  p.delayFor(3));
            assertEquals(Duration.ofSeconds(16), p.delayFor(4));
            assertEquals(Duration.ofSeconds(16), p.delayFor(5));
        }

        @Test
        @DisplayName("non-decreasing and never above the cap, even for huge n")
        void monotoneAndCapped() {
            for (BackoffPolicy p : new BackoffPolicy[]{BackoffPolicy.REST, BackoffPolicy.ORDER, BackoffPolicy.EXCHANGE_REJECTION}) {
                Duration previous = Duration.ZERO;
                for (int n = 1; n <= 5_000; n++) {
                    Duration d = p.delayFor(n);
                    assertTrue(d.compareTo(previous) >= 0, "decreased at n=" + n);
                    assertTrue(d.compareTo(p.maxDelay()) <= 0, "above cap at n=" + n);
                    previous = d;
                }
                assertEquals(p.maxDelay(), p.delayFor(Integer.MAX_VALUE));
            }
        }

        @Test
        @DisplayName("n below 1 is treated as the first denial")
        void zeroTreatedAsFirst() {
            assertEquals(BackoffPolicy.REST.delayFor(1), BackoffPolicy.REST.delayFor(0));
        }
    }

    @Test
    @DisplayName("warns only past the threshold")
    void warnThreshold() {
        assertFalse(BackoffPolicy.REST.shouldWarn(20));
        assertTrue(BackoffPolicy.REST.shouldWarn(21));
        assertFalse(BackoffPolicy.ORDER.shouldWarn(15));
        assertTrue(BackoffPolicy.ORDER.shouldWarn(16));
    }

    @Test
    @DisplayName("rejects a shrinking multiplier")
    void rejectsShrinkingMultiplier() {
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(Duration.ofMillis(100), 0.5, Duration.ofSeconds(1), 1));
    }
}
