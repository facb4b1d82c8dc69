package com.tradebot.session.controller;

import com.tradebot.common.exception.ExchangeCallException;
import com.tradebot.common.exception.InvalidCredentialsException;
import com.tradebot.common.ratelimit.RequestAdmission;
import com.tradebot.session.client.TradingClientHandle;
import com.tradebot.session.dto.LoginRequest;
import com.tradebot.session.service.SessionService;
import com.tradebot.session.session.SessionRegistry;
import com.tradebot.session.support.FakeTradingClient;
import com.tradebot.session.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

class SessionControllerTest {

    private RequestAdmission admission;
    private SessionRegistry registry;
    private Supplier<TradingClientHandle> nextClient;
    private WebTestClient web;

    @BeforeEach
    void setUp() {
        admission = new RequestAdmission();
        registry = new SessionRegistry((id, name) -> ctx -> ctx.token().whenCancelled(),
            admission, Duration.ofSeconds(1), new MutableClock(Instant.parse("2026-05-01T00:00:00Z")));
        nextClient = () -> FakeTradingClient.returning(FakeTradingClient.KRW_ONLY);
        SessionService service = new SessionService(registry, vault -> nextClient.get(), Duration.ofSeconds(1));
        web = WebTestClient.bindToController(new SessionController(service, registry, admission))
            .controllerAdvice(new SessionExceptionHandler())
            .build();
    }

    private WebTestClient.ResponseSpec login(long userId, String accessKey, String secretKey) {
        return web.post().uri("/api/v1/sessions/login")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new LoginRequest(userId, "user" + userId, accessKey, secretKey))
            .exchange();
    }

    @Test
    @DisplayName("login returns the session view without credentials")
    void loginReturnsView() {
        login(1L, "access-key-1", "secret-key-1")
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.userId").isEqualTo(1)
            .jsonPath("$.loggedIn").isEqualTo(true)
            .jsonPath("$.engineRunning").isEqualTo(false)
            .jsonPath("$.accessKey").doesNotExist()
            .jsonPath("$.secretKey").doesNotExist();
    }

    @Test
    @DisplayName("blank keys → 401")
    void blankKeys() {
        login(1L, "", "secret").expectStatus().isUnauthorized();
    }

    @Test
    @DisplayName("exchange rejects keys → 401")
    void rejectedKeys() {
        nextClient = () -> FakeTradingClient.failing(new InvalidCredentialsException("getAccounts", "bad keys"));
        login(1L, "access", "wrong").expectStatus().isUnauthorized();
    }

    @Test
    @DisplayName("exchange unreachable → 502")
    void exchangeDown() {
        nextClient = () -> FakeTradingClient.failing(new ExchangeCallException("getAccounts", "connection refused"));
        login(1L, "access", "secret").expectStatus().isEqualTo(502);
    }

    @Test
    @DisplayName("unknown session → 404")
    void unknownSession() {
        web.get().uri("/api/v1/sessions/9").exchange().expectStatus().isNotFound();
        web.post().uri("/api/v1/sessions/9/trading/start").exchange().expectStatus().isNotFound();
        web.post().uri("/api/v1/sessions/9/trading/stop").exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("start, double start, stop")
    void tradingLifecycle() {
        login(1L, "access", "secret").expectStatus().isOk();

        web.post().uri("/api/v1/sessions/1/trading/start").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.engineRunning").isEqualTo(true);
        web.post().uri("/api/v1/sessions/1/trading/start").exchange()
            .expectStatus().isEqualTo(409);
        web.post().uri("/api/v1/sessions/1/trading/stop").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.engineRunning").isEqualTo(false);
    }

    @Test
    @DisplayName("logout → 204 and the session is gone")
    void logout() {
        login(1L, "access", "secret").expectStatus().isOk();

        web.delete().uri("/api/v1/sessions/1").exchange().expectStatus().isNoContent();
        web.get().uri("/api/v1/sessions/1").exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("admin listing shows every live session")
    void listing() {
        login(2L, "access-2", "secret-2").expectStatus().isOk();
        login(1L, "access-1", "secret-1").expectStatus().isOk();

        web.get().uri("/api/v1/sessions").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[0].userId").isEqualTo(1)
            .jsonPath("$[1].userId").isEqualTo(2);
    }

    @Test
    @DisplayName("capacity reports the shared headroom")
    void capacity() {
        admission.record(com.tradebot.common.ratelimit.CallClass.ORDER);

        web.get().uri("/api/v1/sessions/rate-limit/capacity").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.restRemainingPerSecond").isEqualTo(10)
            .jsonPath("$.orderRemainingPerSecond").isEqualTo(7)
            .jsonPath("$.accountCallsLastMinute").isEqualTo(1);
    }

    @Test
    @DisplayName("health → OK")
    void health() {
        web.get().uri("/api/v1/sessions/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
