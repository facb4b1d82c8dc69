package com.tradebot.session.engine;

import reactor.core.publisher.Mono;

/**
 * A per-session trading loop supplied from outside this service (signal detection,
 * position monitoring and so on).
 *
 * <p>Contract:
 * <ul>
 *   <li>the returned {@code Mono} runs the loop and completes when the loop has exited;</li>
 *   <li>the loop checks {@code context.token().isCancelled()} at every iteration boundary and
 *       exits when it is set;</li>
 *   <li>exchange calls go through {@code context.client()}, which applies admission control;</li>
 *   <li>the engine reaches its own session only through {@code context}.</li>
 * </ul>
 */
@FunctionalInterface
public interface TradingEngine {

    Mono<Void> run(EngineContext context);
}
