package com.tradebot.session.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Periodically tears down sessions nobody has touched for {@code session.max-idle}. */
@Component
public class IdleSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionSweeper.class);

    private final SessionRegistry registry;
    private final Duration maxIdle;

    public IdleSessionSweeper(SessionRegistry registry, @Value("${session.max-idle:24h}") Duration maxIdle) {
        this.registry = registry;
        this.maxIdle  = maxIdle;
    }

    @Scheduled(fixedDelayString = "${session.sweep-interval-ms:600000}",
               initialDelayString = "${session.sweep-interval-ms:600000}")
    public void sweep() {
        int evicted = registry.evictIdle(maxIdle);
        log.debug("Idle session sweep. evicted={} active={} maxIdle={}", evicted, registry.activeSessionCount(), maxIdle);
    }
}
