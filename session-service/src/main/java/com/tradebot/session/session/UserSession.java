package com.tradebot.session.session;

import com.tradebot.common.ratelimit.RequestAdmission;
import com.tradebot.session.client.TradingClientHandle;
import com.tradebot.session.client.dto.AccountBalance;
import com.tradebot.session.dto.SessionView;
import com.tradebot.session.engine.EngineBinding;
import com.tradebot.session.engine.EngineContext;
import com.tradebot.session.engine.TradingEngine;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Everything one user's trading needs, owned by that user alone: the credential vault,
 * the exchange client built on it, the engine binding and the login snapshot.
 *
 * <p>Mutation goes through {@link SessionRegistry}; the engine reaches the session only
 * through its {@link EngineContext}.
 */
public final class UserSession {

    public static final String QUOTE_CURRENCY = "KRW";

    private final long userId;
    private final String username;
    private final CredentialVault credentials = new CredentialVault();
    private final EngineBinding engine;
    private final Instant createdAt;
    private final Clock clock;

    private volatile TradingClientHandle client;
    private volatile LoginSnapshot loginSnapshot = LoginSnapshot.loggedOut();
    private volatile Instant lastAccess;
    private volatile boolean closed;

    UserSession(long userId, String username, TradingEngine tradingEngine,
                RequestAdmission admission, Clock clock) {
        this.userId     = userId;
        this.username   = username;
        this.clock      = clock;
        this.createdAt  = clock.instant();
        this.lastAccess = createdAt;
        this.engine     = new EngineBinding(userId, tradingEngine,
            token -> new EngineContext(userId, this::client, admission, token, this::refreshAccounts));
    }

    public long userId()                 { return userId; }
    public String username()             { return username; }
    public Instant createdAt()           { return createdAt; }
    public Instant lastAccess()          { return lastAccess; }
    public LoginSnapshot loginSnapshot() { return loginSnapshot; }
    public EngineBinding engine()        { return engine; }

    /** The session's client, {@code null} before login and after teardown. */
    public TradingClientHandle client() {
        return client;
    }

    public boolean hasCredentials() {
        return credentials.hasCredentials();
    }

    public boolean isLoggedIn() {
        return loginSnapshot.loggedIn();
    }

    public boolean isClosed() {
        return closed;
    }

    public SessionView toView() {
        LoginSnapshot snapshot = loginSnapshot;
        return new SessionView(userId, username, snapshot.loggedIn(), snapshot.loginTime(),
            snapshot.balanceOf(QUOTE_CURRENCY), engine.isRunning(), createdAt, lastAccess);
    }

    @Override
    public String toString() {
        return "UserSession[userId=" + userId + ", username=" + username + ", " + credentials + "]";
    }

    // ── registry-owned mutation ─────────────────────────────────────────────
    //
    // Every mutator refuses a torn-down session, so a handle that lost a
    // replacement race can never be refilled with secrets.

    CredentialVault credentials() {
        return credentials;
    }

    void touch() {
        lastAccess = clock.instant();
    }

    synchronized void updateCredentials(String accessKey, String secretKey) {
        ensureOpen("update credentials");
        credentials.update(accessKey, secretKey);
        touch();
    }

    /** Closes {@code newClient} and throws when the session is already torn down. */
    synchronized void attachClient(TradingClientHandle newClient) {
        if (closed) {
            newClient.close();
            throw new IllegalStateException("Session is closed, cannot attach client. userId=" + userId);
        }
        TradingClientHandle previous = client;
        client = newClient;
        if (previous != null && previous != newClient) {
            previous.close();
        }
    }

    synchronized void updateLoginSnapshot(boolean loggedIn, List<AccountBalance> accounts) {
        ensureOpen("update login status");
        loginSnapshot = new LoginSnapshot(loggedIn, accounts, loggedIn ? clock.instant() : null);
        touch();
    }

    /** Engine-side account refresh. Keeps the login time; ignored once logged out. */
    private synchronized void refreshAccounts(List<AccountBalance> accounts) {
        LoginSnapshot current = loginSnapshot;
        if (!closed && current.loggedIn()) {
            loginSnapshot = new LoginSnapshot(true, accounts, current.loginTime());
        }
    }

    /**
     * Terminal. Secrets are wiped before the client is closed, so they are gone even
     * when closing the client throws.
     */
    synchronized void clearSecrets() {
        closed = true;
        credentials.clear();
        loginSnapshot = LoginSnapshot.loggedOut();
        TradingClientHandle previous = client;
        client = null;
        if (previous != null) {
            previous.close();
        }
    }

    private void ensureOpen(String action) {
        if (closed) {
            throw new IllegalStateException("Session is closed, cannot " + action + ". userId=" + userId);
        }
    }
}
