package com.chaininsights.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the round id (and, for per-miner log lines, the miner hotkey) through reactive
 * validation pipelines.
 *
 * <p>Reactor Context is the single source of truth for the id inside a round. MDC is only
 * written for the duration of one log statement, never kept as a ThreadLocal across operators,
 * because miner calls hop between scheduler threads.
 *
 * <p>Usage:
 * <pre>
 *     return TraceContextUtil.withRoundId(pipeline, snapshot.roundId());
 *     ...
 *     signal -> TraceContextUtil.getRoundId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String HOTKEY_KEY   = "hotkey";

    private TraceContextUtil() {}

    /**
     * Stores the round id in the Reactor Context. {@code contextWrite} propagates upstream,
     * so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withRoundId(Mono<T> mono, String roundId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, roundId));
    }

    /**
     * @return the round id, or {@code "unknown"} if absent, never {@code null}
     */
    public static String getRoundId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Bridges the round id into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String roundId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, roundId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }

    /**
     * Same as {@link #withMdc(String, Runnable)} for a log line about one miner; the hotkey is
     * bridged as well so per-miner lines can be filtered across a round.
     */
    public static void withMdc(String roundId, String hotkey, Runnable logAction) {
        MDC.put(HOTKEY_KEY, hotkey);
        try {
            withMdc(roundId, logAction);
        } finally {
            MDC.remove(HOTKEY_KEY);
        }
    }
}
