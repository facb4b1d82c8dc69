package com.tradebot.common.ratelimit;

import reactor.core.scheduler.Scheduler;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic nanosecond clock used to stamp rate records.
 *
 * <p>Only differences between two readings are meaningful.
 */
@FunctionalInterface
public interface TimeSource {

    long nanoTime();

    static TimeSource system() {
        return System::nanoTime;
    }

    /** Reads the clock of a Reactor scheduler, so virtual time drives the windows too. */
    static TimeSource of(Scheduler scheduler) {
        return () -> scheduler.now(TimeUnit.NANOSECONDS);
    }
}
