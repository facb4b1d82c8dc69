package com.tradebot.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the owning user id through reactive session pipelines.
 *
 * <p>Reactor Context is the single source of truth for the user id inside a pipeline.
 * MDC is only ever written as a temporary bridge around a log statement, never as a
 * persistent ThreadLocal store.
 *
 * <pre>
 *     return SessionLogContext.withUserId(pipeline, userId);
 *     ...
 *     .doOnEach(signal -> SessionLogContext.withMdc(
 *         SessionLogContext.getUserId(signal.getContextView()), () -> log.info(...)))
 * </pre>
 */
public final class SessionLogContext {

    public static final String USER_ID_KEY = "userId";

    private SessionLogContext() {}

    /**
     * Stores {@code userId} in the Reactor Context of {@code mono}.
     * Call at the end of pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withUserId(Mono<T> mono, long userId) {
        return mono.contextWrite(ctx -> ctx.put(USER_ID_KEY, String.valueOf(userId)));
    }

    /** The user id from the context, or {@code "unknown"}. Never {@code null}. */
    public static String getUserId(ContextView ctx) {
        return ctx.getOrDefault(USER_ID_KEY, "unknown");
    }

    /** Bridges {@code userId} into MDC for the duration of {@code logAction} only. */
    public static void withMdc(String userId, Runnable logAction) {
        MDC.put(USER_ID_KEY, userId);
        try {
            logAction.run();
        } finally {
            MDC.remove(USER_ID_KEY);
        }
    }
}
