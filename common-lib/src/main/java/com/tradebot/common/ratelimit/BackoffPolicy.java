package com.tradebot.common.ratelimit;

import java.time.Duration;

/**
 * Geometric wait schedule applied between admission probes.
 *
 * <pre>
 *   delay(n) = min(maxDelay, initialDelay × multiplier^(n-1))     n = consecutive denials, n ≥ 1
 * </pre>
 *
 * <p>The schedule is non-decreasing in {@code n} and never exceeds {@code maxDelay}.
 *
 * @param initialDelay wait after the first denial
 * @param multiplier   growth factor per consecutive denial (≥ 1.0)
 * @param maxDelay     hard ceiling for any single wait
 * @param warnAfter    consecutive denials past which every further denial is logged at WARN
 */
public record BackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay, int warnAfter) {

    /** REST class: 0.2s × 1.2ⁿ, capped at 6s. */
    public static final BackoffPolicy REST =
        new BackoffPolicy(Duration.ofMillis(200), 1.2, Duration.ofSeconds(6), 20);

    /** Order class: 0.3s × 1.5ⁿ, capped at 10s. More conservative than REST. */
    public static final BackoffPolicy ORDER =
        new BackoffPolicy(Duration.ofMillis(300), 1.5, Duration.ofSeconds(10), 15);

    /** Secondary schedule after the exchange answered 429: 2s, 4s, 8s, 16s, 16s … */
    public static final BackoffPolicy EXCHANGE_REJECTION =
        new BackoffPolicy(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(16), 0);

    public BackoffPolicy {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Wait to apply after {@code consecutiveDenials} denials in a row.
     * Values below 1 are treated as the first denial.
     */
    public Duration delayFor(int consecutiveDenials) {
        int n = Math.max(1, consecutiveDenials);
        double nanos = initialDelay.toNanos() * Math.pow(multiplier, n - 1);
        long max = maxDelay.toNanos();
        if (Double.isInfinite(nanos) || nanos >= max) {
            return maxDelay;
        }
        return Duration.ofNanos(Math.round(nanos));
    }

    public boolean shouldWarn(int consecutiveDenials) {
        return consecutiveDenials > warnAfter;
    }
}
