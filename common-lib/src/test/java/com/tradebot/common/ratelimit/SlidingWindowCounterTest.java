package com.tradebot.common.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowCounterTest {

    private static final long MS = 1_000_000L;

    private final AtomicLong now = new AtomicLong();
    private SlidingWindowCounter counter;

    @BeforeEach
    void setUp() {
        now.set(0);
        counter = new SlidingWindowCounter(now::get);
    }

    @Test
    @DisplayName("a record exactly 1s old still counts in the second window")
    void secondWindowIsInclusive() {
        counter.record();
        now.set(1_000 * MS);
        assertEquals(1, counter.countLastSecond());
        now.set(1_000 * MS + 1);
        assertEquals(0, counter.countLastSecond());
        assertEquals(1, counter.countLastMinute());
    }

    @Test
    @DisplayName("records older than 60s are pruned")
    void minuteWindowPrunes() {
        counter.record();
        now.set(60_000 * MS);
        assertEquals(1, counter.countLastMinute());
        now.set(60_000 * MS + 1);
        assertEquals(0, counter.countLastMinute());
    }

    @Test
    @DisplayName("headroom needs room in both windows")
    void headroomChecksBothWindows() {
        for (int i = 0; i < 3; i++) {
            counter.record();
        }
        assertFalse(counter.hasHeadroom(3, 100));
        assertFalse(counter.hasHeadroom(10, 3));
        assertTrue(counter.hasHeadroom(4, 4));
    }

    @Test
    @DisplayName("hasHeadroom has no side effect")
    void hasHeadroomIsPure() {
        counter.record();
        assertEquals(counter.hasHeadroom(2, 10), counter.hasHeadroom(2, 10));
        assertEquals(1, counter.countLastMinute());
    }

    @Test
    @DisplayName("tryRecord records nothing when full")
    void tryRecordWhenFull() {
        assertTrue(counter.tryRecord(2, 10));
        assertTrue(counter.tryRecord(2, 10));
        assertFalse(counter.tryRecord(2, 10));
        assertEquals(2, counter.countLastSecond());
    }

    @Test
    @DisplayName("concurrent tryRecord never overshoots the cap")
    void concurrentTryRecord() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 100; i++) {
                        if (counter.tryRecord(10, 600)) {
                            granted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(10, granted.get());
        assertEquals(10, counter.countLastSecond());
    }
}
