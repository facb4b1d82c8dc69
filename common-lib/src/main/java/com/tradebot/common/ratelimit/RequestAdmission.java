package com.tradebot.common.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Account-wide admission control for exchange calls.
 *
 * <p>One instance models the exchange's per-account ceiling and is shared by every
 * user session's trading engine. Each {@link CallClass} has its own
 * {@link SlidingWindowCounter} (and therefore its own lock); a third counter tracks
 * all calls combined.
 *
 * <p>A denied admission is backpressure, not an error: {@link #awaitSlot} and
 * {@link #execute} delay the calling pipeline with {@code Mono.delay} on the configured
 * scheduler and re-probe, following the class's {@link BackoffPolicy}. No thread is
 * blocked while waiting, and neither method ever signals an error of its own.
 *
 * <p>A 429 from the exchange despite local admission is a separate path, see
 * {@link #backOffAfterRejection}. It waits but does not tighten the local caps.
 */
public class RequestAdmission {

    private static final Logger log = LoggerFactory.getLogger(RequestAdmission.class);

    private final Map<CallClass, SlidingWindowCounter> counters = new EnumMap<>(CallClass.class);
    private final SlidingWindowCounter combined;
    private final Scheduler scheduler;

    public RequestAdmission() {
        this(TimeSource.system(), Schedulers.parallel());
    }

    public RequestAdmission(TimeSource clock, Scheduler scheduler) {
        for (CallClass callClass : CallClass.values()) {
            counters.put(callClass, new SlidingWindowCounter(clock));
        }
        this.combined  = new SlidingWindowCounter(clock);
        this.scheduler = scheduler;
    }

    /**
     * True if one more {@code callClass} call fits in both its 1s and 60s windows.
     * Apart from pruning expired records this has no side effect.
     */
    public boolean admit(CallClass callClass) {
        return counter(callClass).hasHeadroom(callClass.perSecondCap(), callClass.perMinuteCap());
    }

    /**
     * Completes once {@link #admit} returns true. The caller must still {@link #record}
     * after issuing its network call.
     */
    public Mono<Void> awaitSlot(CallClass callClass) {
        return Mono.defer(() -> probe(callClass, () -> admit(callClass), 0));
    }

    /** Appends a record to the class sequence, then to the combined sequence. */
    public void record(CallClass callClass) {
        counter(callClass).record();
        combined.record();
    }

    /**
     * Waits for a slot, records it and only then subscribes to the operation returned by
     * {@code operation}. Its value or error is propagated unchanged.
     *
     * <p>The slot is claimed with an atomic check-and-record, so concurrent producers can
     * not both pass the check for the last free slot.
     */
    public <T> Mono<T> execute(CallClass callClass, Supplier<? extends Mono<T>> operation) {
        return Mono.defer(() -> probe(callClass, () -> claim(callClass), 0))
            .then(Mono.defer(operation));
    }

    public RemainingCapacity remainingCapacity() {
        SlidingWindowCounter rest  = counter(CallClass.REST);
        SlidingWindowCounter order = counter(CallClass.ORDER);
        return new RemainingCapacity(
            CallClass.REST.perSecondCap()  - rest.countLastSecond(),
            CallClass.REST.perMinuteCap()  - rest.countLastMinute(),
            CallClass.ORDER.perSecondCap() - order.countLastSecond(),
            CallClass.ORDER.perMinuteCap() - order.countLastMinute(),
            combined.countLastMinute()
        );
    }

    /**
     * Secondary backoff after the exchange answered 429 although local admission passed.
     *
     * <p>Waits 2s, 4s, 8s, 16s, 16s … and re-probes {@link #admit} after every step,
     * completing at the first step where it returns true. Every step is logged at WARN.
     */
    public Mono<Void> backOffAfterRejection(CallClass callClass) {
        return Mono.defer(() -> rejectionStep(callClass, 1));
    }

    // ── internal ─────────────────────────────────────────────────────────────

    private boolean claim(CallClass callClass) {
        if (!counter(callClass).tryRecord(callClass.perSecondCap(), callClass.perMinuteCap())) {
            return false;
        }
        combined.record();
        return true;
    }

    private Mono<Void> probe(CallClass callClass, BooleanSupplier admitted, int denials) {
        if (admitted.getAsBoolean()) {
            if (denials > 0) {
                log.debug("Admission granted. callClass={} afterDenials={}", callClass, denials);
            }
            return Mono.empty();
        }
        int next = denials + 1;
        BackoffPolicy backoff = callClass.backoff();
        if (backoff.shouldWarn(next)) {
            log.warn("Still waiting for rate limit slot. callClass={} consecutiveDenials={}", callClass, next);
        }
        return Mono.delay(backoff.delayFor(next), scheduler)
            .then(Mono.defer(() -> probe(callClass, admitted, next)));
    }

    private Mono<Void> rejectionStep(CallClass callClass, int step) {
        var wait = BackoffPolicy.EXCHANGE_REJECTION.delayFor(step);
        log.warn("Exchange rate limit backoff. callClass={} step={} waitMs={}", callClass, step, wait.toMillis());
        return Mono.delay(wait, scheduler)
            .then(Mono.defer(() -> {
                if (admit(callClass)) {
                    log.info("Exchange rate limit backoff finished. callClass={} steps={}", callClass, step);
                    return Mono.<Void>empty();
                }
                return rejectionStep(callClass, step + 1);
            }));
    }

    private SlidingWindowCounter counter(CallClass callClass) {
        return counters.get(callClass);
    }
}
