package com.tradebot.common.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SessionLogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("user id written at assembly end is visible upstream")
    void userIdVisibleUpstream() {
        Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(SessionLogContext.getUserId(ctx)));

        StepVerifier.create(SessionLogContext.withUserId(pipeline, 42L))
            .expectNext("42")
            .verifyComplete();
    }

    @Test
    @DisplayName("missing user id → \"unknown\"")
    void missingUserId() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(SessionLogContext.getUserId(ctx))))
            .expectNext("unknown")
            .verifyComplete();
    }

    @Test
    @DisplayName("MDC holds the user id only while the action runs")
    void mdcIsTemporary() {
        AtomicReference<String> seen = new AtomicReference<>();
        SessionLogContext.withMdc("7", () -> seen.set(MDC.get(SessionLogContext.USER_ID_KEY)));

        assertEquals("7", seen.get());
        assertNull(MDC.get(SessionLogContext.USER_ID_KEY));
    }

    @Test
    @DisplayName("MDC is cleaned up when the action throws")
    void mdcCleanedOnError() {
        assertThrows(IllegalStateException.class, () -> SessionLogContext.withMdc("7", () -> {
            throw new IllegalStateException("boom");
        }));
        assertNull(MDC.get(SessionLogContext.USER_ID_KEY));
    }
}
