package com.tradebot.session.engine;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request handed to a {@link TradingEngine} run. Engines check
 * {@link #isCancelled()} at iteration boundaries; {@link #whenCancelled()} lets an idle
 * wait end early. Nothing is pre-empted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.Empty<Void> signal = Sinks.empty();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Idempotent. Returns true only for the call that flipped the token. */
    public boolean cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitEmpty();
            return true;
        }
        return false;
    }

    /** Completes when {@link #cancel()} is called, immediately if it already was. */
    public Mono<Void> whenCancelled() {
        return signal.asMono();
    }
}
