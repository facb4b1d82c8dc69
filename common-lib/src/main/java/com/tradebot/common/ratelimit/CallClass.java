package com.tradebot.common.ratelimit;

/**
 * Exchange call classes, each capped independently by the exchange.
 *
 * <ul>
 *   <li>{@link #REST}: read calls (ticker, candles, account and order queries): 10/s, 600/min</li>
 *   <li>{@link #ORDER}: order placement and cancellation: 8/s, 200/min</li>
 * </ul>
 */
public enum CallClass {
    REST(10, 600, BackoffPolicy.REST),
    ORDER(8, 200, BackoffPolicy.ORDER);

    private final int perSecondCap;
    private final int perMinuteCap;
    private final BackoffPolicy backoff;

    CallClass(int perSecondCap, int perMinuteCap, BackoffPolicy backoff) {
        this.perSecondCap = perSecondCap;
        this.perMinuteCap = perMinuteCap;
        this.backoff      = backoff;
    }

    public int perSecondCap()      { return perSecondCap; }
    public int perMinuteCap()      { return perMinuteCap; }
    public BackoffPolicy backoff() { return backoff; }
}
