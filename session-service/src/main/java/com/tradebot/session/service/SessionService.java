package com.tradebot.session.service;

import com.tradebot.common.exception.InvalidCredentialsException;
import com.tradebot.common.trace.SessionLogContext;
import com.tradebot.session.client.TradingClientFactory;
import com.tradebot.session.client.TradingClientHandle;
import com.tradebot.session.session.CredentialVault;
import com.tradebot.session.session.SessionNotFoundException;
import com.tradebot.session.session.SessionRegistry;
import com.tradebot.session.session.UserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Session lifecycle as the web layer sees it.
 *
 * <p>Login verifies the keys against the exchange before any session exists: a throwaway
 * vault and client make one admitted {@code getAccounts()} call, and only a successful
 * answer creates (or replaces) the user's session. Rejected keys leave the registry
 * untouched. The session is populated before it is registered, so overlapping logins for
 * one user each publish a complete session and the later one wins.
 */
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRegistry registry;
    private final TradingClientFactory clientFactory;
    private final Duration engineStopTimeout;

    public SessionService(SessionRegistry registry, TradingClientFactory clientFactory, Duration engineStopTimeout) {
        this.registry          = registry;
        this.clientFactory     = clientFactory;
        this.engineStopTimeout = engineStopTimeout;
    }

    public Mono<UserSession> login(long userId, String username, String accessKey, String secretKey) {
        if (isBlank(accessKey) || isBlank(secretKey)) {
            return Mono.error(new InvalidCredentialsException("login", "access key and secret key are required"));
        }
        Mono<UserSession> pipeline = Mono.defer(() -> {
            CredentialVault trialVault = new CredentialVault();
            trialVault.update(accessKey, secretKey);
            TradingClientHandle verifier = clientFactory.create(trialVault);
            return verifier.getAccounts()
                .doFinally(signal -> {
                    verifier.close();
                    trialVault.clear();
                })
                .map(accounts -> registry.createSession(userId, username, session -> {
                    registry.updateCredentials(session, accessKey, secretKey);
                    registry.attachClient(session, clientFactory);
                    registry.updateLoginStatus(session, true, accounts);
                }));
        })
        .doOnEach(signal -> {
            if (signal.isOnNext()) {
                SessionLogContext.withMdc(SessionLogContext.getUserId(signal.getContextView()), () ->
                    log.info("Login succeeded. userId={} username={}", userId, username));
            } else if (signal.isOnError()) {
                SessionLogContext.withMdc(SessionLogContext.getUserId(signal.getContextView()), () ->
                    log.warn("Login failed. userId={} error={}", userId, signal.getThrowable().getMessage()));
            }
        });
        return SessionLogContext.withUserId(pipeline, userId);
    }

    /**
     * Starts the session's engine.
     *
     * @throws SessionNotFoundException when the user has no session
     * @throws IllegalStateException    when not logged in, already trading, or torn down meanwhile
     */
    public UserSession startTrading(long userId) {
        UserSession session = registry.getSession(userId).orElseThrow(() -> new SessionNotFoundException(userId));
        if (!session.isLoggedIn() || !session.hasCredentials()) {
            throw new IllegalStateException("Session is not logged in. userId=" + userId);
        }
        session.engine().start();
        return session;
    }

    /** Asks the engine to stop and completes once its loop has exited, or after the stop timeout. */
    public Mono<Void> stopTrading(long userId) {
        return Mono.defer(() -> registry.getSession(userId)
            .map(session -> session.engine().stop(engineStopTimeout)
                .onErrorResume(TimeoutException.class, e -> Mono.empty()))
            .orElseGet(() -> Mono.error(new SessionNotFoundException(userId))));
    }

    public Mono<Void> logout(long userId) {
        log.info("Logout requested. userId={}", userId);
        return registry.removeSessionAsync(userId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
