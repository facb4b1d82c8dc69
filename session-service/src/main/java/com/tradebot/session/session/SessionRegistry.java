package com.tradebot.session.session;

import com.tradebot.common.ratelimit.RequestAdmission;
import com.tradebot.session.client.TradingClientFactory;
import com.tradebot.session.client.TradingClientHandle;
import com.tradebot.session.client.dto.AccountBalance;
import com.tradebot.session.dto.SessionView;
import com.tradebot.session.engine.TradingEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Live sessions keyed by user id, at most one per user.
 *
 * <p>Creation and replacement are atomic per user id: the prior session is torn down
 * inside the map's {@code compute} before the new one becomes visible. Removal takes the
 * entry out of the map before tearing it down, so a session under teardown is never
 * handed out again.
 *
 * <p>Teardown is terminal: the engine binding is closed against restarts and every
 * session mutator refuses a torn-down session.
 *
 * <p>Teardown never throws. Engine errors and stop timeouts are logged; the credentials
 * and client handle are cleared regardless.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentMap<Long, UserSession> sessions = new ConcurrentHashMap<>();
    private final TradingEngineFactory engineFactory;
    private final RequestAdmission admission;
    private final Duration engineStopTimeout;
    private final Clock clock;

    public SessionRegistry(TradingEngineFactory engineFactory, RequestAdmission admission,
                           Duration engineStopTimeout, Clock clock) {
        this.engineFactory     = engineFactory;
        this.admission         = admission;
        this.engineStopTimeout = engineStopTimeout;
        this.clock             = clock;
    }

    /** Registers a fresh session for {@code userId}, tearing down any existing one first. */
    public UserSession createSession(long userId, String username) {
        return createSession(userId, username, session -> {});
    }

    /**
     * Like {@link #createSession(long, String)}, but runs {@code initializer} on the new
     * session before it is registered, so no other caller ever sees it half populated.
     * If the initializer throws, the new session is torn down, nothing is registered and
     * any existing session is left in place.
     */
    public UserSession createSession(long userId, String username, Consumer<UserSession> initializer) {
        UserSession fresh = new UserSession(userId, username,
            engineFactory.create(userId, username), admission, clock);
        try {
            initializer.accept(fresh);
        } catch (RuntimeException e) {
            teardown(fresh);
            throw e;
        }
        sessions.compute(userId, (id, existing) -> {
            if (existing != null) {
                log.info("Replacing existing session. userId={} previousCreatedAt={}", id, existing.createdAt());
                teardown(existing);
            }
            return fresh;
        });
        log.info("Session created. userId={} username={} active={}", userId, username, sessions.size());
        return fresh;
    }

    /** The live session for {@code userId}, touching its last-access time. Never creates one. */
    public Optional<UserSession> getSession(long userId) {
        UserSession session = sessions.get(userId);
        if (session == null) {
            return Optional.empty();
        }
        session.touch();
        return Optional.of(session);
    }

    /**
     * Synchronous teardown: flags the engine stopped, disposes its in-flight work and
     * clears the session's secrets without waiting for the engine to exit.
     */
    public void removeSession(long userId) {
        UserSession session = sessions.remove(userId);
        if (session == null) {
            log.warn("Remove requested for unknown session. userId={}", userId);
            return;
        }
        teardown(session);
        log.info("Session removed. userId={} active={}", userId, sessions.size());
    }

    /**
     * Unregisters the session, then waits (bounded by the configured stop timeout) for
     * its engine to exit before clearing secrets. Completes empty when no session exists
     * and never signals an error.
     */
    public Mono<Void> removeSessionAsync(long userId) {
        return Mono.defer(() -> {
            UserSession session = sessions.remove(userId);
            if (session == null) {
                log.debug("Async remove found no session. userId={}", userId);
                return Mono.<Void>empty();
            }
            return session.engine().close(engineStopTimeout)
                .onErrorResume(e -> {
                    log.warn("Engine stop failed during teardown, clearing anyway. userId={} error={}",
                        userId, e.toString());
                    return Mono.empty();
                })
                .then(Mono.fromRunnable(() -> {
                    teardown(session);
                    log.info("Session removed after engine exit. userId={} active={}", userId, sessions.size());
                }))
                .doOnCancel(() -> teardown(session))
                .then();
        });
    }

    /** @throws IllegalStateException when the session has been torn down */
    public void updateCredentials(UserSession session, String accessKey, String secretKey) {
        session.updateCredentials(accessKey, secretKey);
        log.info("Credentials updated. userId={}", session.userId());
    }

    /**
     * Builds the session's client over its own vault and attaches it, closing any previous one.
     *
     * @throws IllegalStateException when the session has been torn down; the new client is closed
     */
    public TradingClientHandle attachClient(UserSession session, TradingClientFactory clientFactory) {
        TradingClientHandle client = clientFactory.create(session.credentials());
        session.attachClient(client);
        return client;
    }

    /** @throws IllegalStateException when the session has been torn down */
    public void updateLoginStatus(UserSession session, boolean loggedIn, List<AccountBalance> accounts) {
        session.updateLoginSnapshot(loggedIn, accounts);
        log.info("Login status updated. userId={} loggedIn={} currencies={}",
            session.userId(), loggedIn, accounts == null ? 0 : accounts.size());
    }

    /** Tears down every session idle for longer than {@code maxIdle}. Returns how many were removed. */
    public int evictIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        int evicted = 0;
        for (Map.Entry<Long, UserSession> entry : sessions.entrySet()) {
            UserSession session = entry.getValue();
            if (session.lastAccess().isBefore(cutoff) && sessions.remove(entry.getKey(), session)) {
                log.info("Evicting idle session. userId={} lastAccess={}", entry.getKey(), session.lastAccess());
                teardown(session);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Idle sweep finished. evicted={} active={}", evicted, sessions.size());
        }
        return evicted;
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /** Snapshot of every live session, ordered by user id. */
    public List<SessionView> sessionViews() {
        List<SessionView> views = new ArrayList<>();
        sessions.values().forEach(s -> views.add(s.toView()));
        views.sort(Comparator.comparingLong(SessionView::userId));
        return views;
    }

    /** Tears every session down. Registered as the bean's destroy method. */
    public void shutdown() {
        log.info("Shutting down session registry. active={}", sessions.size());
        for (Long userId : new ArrayList<>(sessions.keySet())) {
            UserSession session = sessions.remove(userId);
            if (session != null) {
                teardown(session);
            }
        }
    }

    private void teardown(UserSession session) {
        try {
            session.engine().close();
        } catch (RuntimeException e) {
            log.error("Engine teardown failed. userId={}", session.userId(), e);
        }
        try {
            session.clearSecrets();
        } catch (RuntimeException e) {
            log.error("Client close failed during teardown, secrets already cleared. userId={}",
                session.userId(), e);
        }
    }
}
