package com.tradebot.session.engine;

/** Creates the engine owned by a new session. Called once per session. */
@FunctionalInterface
public interface TradingEngineFactory {

    TradingEngine create(long userId, String username);
}
