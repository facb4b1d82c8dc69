package com.tradebot.session.engine;

import com.tradebot.common.trace.SessionLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * A session's 1:1 binding to its {@link TradingEngine}.
 *
 * <p>Each {@link #start()} opens a new run with a fresh {@link CancellationToken} and a
 * completion signal that fires when the engine's pipeline terminates for any reason
 * (complete, error or disposal). Two ways to end a run:
 * <ul>
 *   <li>{@link #requestStop()}: synchronous. Flags the token and disposes the run's
 *       subscription; an in-flight exchange call is cancelled, nothing is awaited.</li>
 *   <li>{@link #stop(Duration)}: flags the token and waits for the engine to exit on its
 *       own. If it has not exited within the timeout the subscription is disposed and
 *       the returned {@code Mono} fails with {@link TimeoutException}.</li>
 * </ul>
 *
 * <p>{@link #close()} and {@link #close(Duration)} end the binding for good: once either
 * has been called, {@link #start()} throws. Start and close share one monitor, so a run
 * can not slip in after teardown.
 *
 * <p>Each run carries the owning user id in its Reactor Context, so exchange calls made
 * by the engine log against the right user.
 */
public class EngineBinding {

    private static final Logger log = LoggerFactory.getLogger(EngineBinding.class);

    private final long userId;
    private final TradingEngine engine;
    private final Function<CancellationToken, EngineContext> contextFactory;

    private volatile Run current;
    private boolean closed; // guarded by this

    public EngineBinding(long userId, TradingEngine engine, Function<CancellationToken, EngineContext> contextFactory) {
        this.userId         = userId;
        this.engine         = engine;
        this.contextFactory = contextFactory;
    }

    /**
     * Starts a new run.
     *
     * @throws IllegalStateException if a run is still active or the binding is closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Engine binding is closed. userId=" + userId);
        }
        if (isRunning()) {
            throw new IllegalStateException("Trading engine already running. userId=" + userId);
        }
        Run run = new Run();
        current = run;
        EngineContext context = contextFactory.apply(run.token);

        String mdcUserId = String.valueOf(userId);
        SessionLogContext.withMdc(mdcUserId, () -> log.info("Trading engine starting. userId={}", userId));
        Mono<Void> pipeline = Mono.defer(() -> engine.run(context))
            .doFinally(signal -> {
                run.finished = true;
                run.done.tryEmitEmpty();
                SessionLogContext.withMdc(mdcUserId, () ->
                    log.info("Trading engine exited. userId={} signal={}", userId, signal));
            });
        run.subscription = SessionLogContext.withUserId(pipeline, userId)
            .subscribe(
                ignored -> {},
                error -> SessionLogContext.withMdc(mdcUserId, () ->
                    log.error("Trading engine failed. userId={}", userId, error))
            );
    }

    /** True while a run is active and has not been asked to stop. */
    public boolean isRunning() {
        Run run = current;
        return run != null && !run.finished && !run.token.isCancelled();
    }

    /** Flags the current run as stopped and drops its in-flight work without waiting. */
    public synchronized void requestStop() {
        Run run = current;
        if (run == null) {
            return;
        }
        if (run.token.cancel()) {
            log.info("Trading engine stop requested. userId={}", userId);
        }
        run.dispose();
    }

    /**
     * Flags the current run as stopped and completes once the engine's loop has exited.
     * Completes immediately when nothing is running.
     */
    public Mono<Void> stop(Duration timeout) {
        return Mono.defer(() -> {
            Run run = current;
            if (run == null || run.finished) {
                return Mono.empty();
            }
            if (run.token.cancel()) {
                log.info("Trading engine stop requested, awaiting exit. userId={} timeoutMs={}", userId, timeout.toMillis());
            }
            return run.done.asMono()
                .timeout(timeout)
                .doOnError(TimeoutException.class, e -> {
                    log.warn("Trading engine did not exit in time, disposing. userId={} timeoutMs={}",
                        userId, timeout.toMillis());
                    run.dispose();
                });
        });
    }

    /** Terminal synchronous stop: no further run can start, the current one is dropped. */
    public synchronized void close() {
        closed = true;
        requestStop();
    }

    /**
     * Terminal cooperative stop: no further run can start, and the returned {@code Mono}
     * behaves like {@link #stop(Duration)} for the current one.
     */
    public Mono<Void> close(Duration timeout) {
        return Mono.defer(() -> {
            synchronized (this) {
                closed = true;
            }
            return stop(timeout);
        });
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private static final class Run {
        final CancellationToken token = new CancellationToken();
        final Sinks.Empty<Void> done = Sinks.empty();
        volatile Disposable subscription;
        volatile boolean finished;

        void dispose() {
            Disposable s = subscription;
            if (s != null && !s.isDisposed()) {
                s.dispose();
            }
        }
    }
}
