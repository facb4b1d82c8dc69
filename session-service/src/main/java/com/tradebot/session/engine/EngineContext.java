package com.tradebot.session.engine;

import com.tradebot.common.ratelimit.RequestAdmission;
import com.tradebot.session.client.TradingClientHandle;
import com.tradebot.session.client.dto.AccountBalance;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Everything one engine run may touch: its own session's client and account sink, the
 * shared admission control, and the run's cancellation token.
 */
public final class EngineContext {

    private final long userId;
    private final Supplier<TradingClientHandle> client;
    private final RequestAdmission admission;
    private final CancellationToken token;
    private final Consumer<List<AccountBalance>> accountSink;

    public EngineContext(long userId,
                         Supplier<TradingClientHandle> client,
                         RequestAdmission admission,
                         CancellationToken token,
                         Consumer<List<AccountBalance>> accountSink) {
        this.userId      = userId;
        this.client      = client;
        this.admission   = admission;
        this.token       = token;
        this.accountSink = accountSink;
    }

    public long userId() { return userId; }

    /** The session's current client handle, {@code null} once the session is torn down. */
    public TradingClientHandle client() { return client.get(); }

    public RequestAdmission admission() { return admission; }

    public CancellationToken token() { return token; }

    /** Publishes a fresh account snapshot to the owning session. */
    public void publishAccounts(List<AccountBalance> accounts) {
        accountSink.accept(accounts);
    }
}
