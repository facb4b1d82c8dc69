package com.tradebot.session.controller;

import com.tradebot.common.ratelimit.RemainingCapacity;
import com.tradebot.common.ratelimit.RequestAdmission;
import com.tradebot.session.dto.LoginRequest;
import com.tradebot.session.dto.SessionView;
import com.tradebot.session.service.SessionService;
import com.tradebot.session.session.SessionRegistry;
import com.tradebot.session.session.UserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Session API for the web layer. Login, status, trading start/stop and logout per user,
 * plus an admin listing and the shared rate-limit headroom.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionService sessionService;
    private final SessionRegistry registry;
    private final RequestAdmission admission;

    public SessionController(SessionService sessionService, SessionRegistry registry, RequestAdmission admission) {
        this.sessionService = sessionService;
        this.registry       = registry;
        this.admission      = admission;
    }

    @PostMapping("/login")
    public Mono<ResponseEntity<SessionView>> login(@RequestBody LoginRequest request) {
        log.info("Login requested. userId={} username={}", request.userId(), request.username());
        return sessionService.login(request.userId(), request.username(), request.accessKey(), request.secretKey())
            .map(UserSession::toView)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{userId}")
    public Mono<ResponseEntity<SessionView>> session(@PathVariable long userId) {
        return Mono.justOrEmpty(registry.getSession(userId))
            .map(UserSession::toView)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{userId}")
    public Mono<ResponseEntity<Void>> logout(@PathVariable long userId) {
        return sessionService.logout(userId)
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/{userId}/trading/start")
    public Mono<ResponseEntity<SessionView>> startTrading(@PathVariable long userId) {
        log.info("Trading start requested. userId={}", userId);
        return Mono.fromCallable(() -> sessionService.startTrading(userId))
            .map(UserSession::toView)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{userId}/trading/stop")
    public Mono<ResponseEntity<SessionView>> stopTrading(@PathVariable long userId) {
        log.info("Trading stop requested. userId={}", userId);
        return sessionService.stopTrading(userId)
            .then(Mono.defer(() -> Mono.justOrEmpty(registry.getSession(userId))))
            .map(UserSession::toView)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping
    public Flux<SessionView> sessions() {
        return Flux.defer(() -> Flux.fromIterable(registry.sessionViews()));
    }

    @GetMapping("/rate-limit/capacity")
    public Mono<ResponseEntity<RemainingCapacity>> capacity() {
        return Mono.fromSupplier(admission::remainingCapacity).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
