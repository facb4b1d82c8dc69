package com.tradebot.session.engine;

import com.tradebot.common.exception.InvalidCredentialsException;
import com.tradebot.session.client.TradingClientHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Default engine: keeps the session's account snapshot fresh. Every {@code interval} it
 * reads the accounts through the session's client and publishes them to the session.
 *
 * <p>A failed refresh is logged and retried on the next cycle, except for rejected
 * credentials, which end the loop. A stop request ends the idle wait at once; a refresh
 * already in flight is allowed to finish.
 */
public class AccountSyncEngine implements TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(AccountSyncEngine.class);

    private final Duration interval;
    private final Scheduler scheduler;

    public AccountSyncEngine(Duration interval, Scheduler scheduler) {
        this.interval  = interval;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Void> run(EngineContext context) {
        CancellationToken token = context.token();
        return Mono.defer(() -> token.isCancelled() ? Mono.<Void>empty() : cycle(context))
            .repeat(() -> !token.isCancelled())
            .then()
            .doOnSubscribe(s -> log.info("Account sync started. userId={} intervalMs={}",
                context.userId(), interval.toMillis()));
    }

    private Mono<Void> cycle(EngineContext context) {
        return refresh(context).then(idle(context.token()));
    }

    private Mono<Void> refresh(EngineContext context) {
        TradingClientHandle client = context.client();
        if (client == null) {
            context.token().cancel();
            return Mono.empty();
        }
        return client.getAccounts()
            .doOnNext(accounts -> {
                context.publishAccounts(accounts);
                log.debug("Accounts refreshed. userId={} currencies={}", context.userId(), accounts.size());
            })
            .then()
            .onErrorResume(InvalidCredentialsException.class, e -> {
                log.error("Account sync stopping, credentials rejected. userId={} error={}",
                    context.userId(), e.getMessage());
                context.token().cancel();
                return Mono.empty();
            })
            .onErrorResume(e -> {
                log.warn("Account sync failed, retrying next cycle. userId={} error={}",
                    context.userId(), e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> idle(CancellationToken token) {
        return Mono.delay(interval, scheduler).then().or(token.whenCancelled());
    }
}
