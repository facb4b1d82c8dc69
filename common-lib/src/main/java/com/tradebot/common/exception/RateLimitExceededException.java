package com.tradebot.common.exception;

import com.tradebot.common.ratelimit.CallClass;

/**
 * The exchange kept answering 429 after the secondary backoff and every retry.
 * Local counters under-counted the account's real usage.
 */
public class RateLimitExceededException extends ExchangeCallException {
    private final CallClass callClass;
    private final int attempts;

    public RateLimitExceededException(String operation, CallClass callClass, int attempts, Throwable cause) {
        super(operation, "exchange rate limit exceeded. callClass=" + callClass + " attempts=" + attempts, cause);
        this.callClass = callClass;
        this.attempts  = attempts;
    }

    public CallClass getCallClass() {
        return callClass;
    }

    public int getAttempts() {
        return attempts;
    }
}
