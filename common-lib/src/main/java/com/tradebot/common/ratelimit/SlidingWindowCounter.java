package com.tradebot.common.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Oldest-first sequence of call timestamps for one call class, trimmed to the trailing minute.
 *
 * <p>Every read and write takes the counter's own lock, and the timestamp of a new record
 * is read while the lock is held, so the sequence stays ordered under concurrent writers.
 */
public final class SlidingWindowCounter {

    public static final Duration SECOND_WINDOW = Duration.ofSeconds(1);
    public static final Duration MINUTE_WINDOW = Duration.ofSeconds(60);

    private static final long SECOND_NANOS = SECOND_WINDOW.toNanos();
    private static final long MINUTE_NANOS = MINUTE_WINDOW.toNanos();

    private final Deque<Long> timestamps = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final TimeSource clock;

    public SlidingWindowCounter(TimeSource clock) {
        this.clock = clock;
    }

    /**
     * True when one more call fits in both the 1s and the 60s window.
     * The only state change is pruning of entries older than the minute window.
     */
    public boolean hasHeadroom(int perSecondCap, int perMinuteCap) {
        lock.lock();
        try {
            long now = clock.nanoTime();
            prune(now);
            return fits(now, perSecondCap, perMinuteCap);
        } finally {
            lock.unlock();
        }
    }

    public void record() {
        lock.lock();
        try {
            long now = clock.nanoTime();
            timestamps.addLast(now);
            prune(now);
        } finally {
            lock.unlock();
        }
    }

    /** Check-and-record in one critical section. Returns false, recording nothing, when either window is full. */
    public boolean tryRecord(int perSecondCap, int perMinuteCap) {
        lock.lock();
        try {
            long now = clock.nanoTime();
            prune(now);
            if (!fits(now, perSecondCap, perMinuteCap)) {
                return false;
            }
            timestamps.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Records inside the trailing second. */
    public int countLastSecond() {
        lock.lock();
        try {
            long now = clock.nanoTime();
            prune(now);
            return countSince(now, SECOND_NANOS);
        } finally {
            lock.unlock();
        }
    }

    /** Records inside the trailing minute. */
    public int countLastMinute() {
        lock.lock();
        try {
            prune(clock.nanoTime());
            return timestamps.size();
        } finally {
            lock.unlock();
        }
    }

    // ── lock held ───────────────────────────────────────────────────────────

    private boolean fits(long now, int perSecondCap, int perMinuteCap) {
        return countSince(now, SECOND_NANOS) < perSecondCap
            && timestamps.size() < perMinuteCap;
    }

    private void prune(long now) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() > MINUTE_NANOS) {
            timestamps.pollFirst();
        }
    }

    private int countSince(long now, long windowNanos) {
        int count = 0;
        Iterator<Long> newestFirst = timestamps.descendingIterator();
        while (newestFirst.hasNext()) {
            if (now - newestFirst.next() > windowNanos) {
                break;
            }
            count++;
        }
        return count;
    }
}
