package com.forecastplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the forecast run id through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the run id inside a
 * pipeline. MDC is only written as a temporary bridge during a log statement,
 * never as a persistent ThreadLocal store.
 *
 * <p>Usage pattern in reactive chains:
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, runId);
 * </pre>
 *
 * <p>Usage pattern inside doOnEach:
 * <pre>
 *     signal -> TraceContextUtil.getRunId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private TraceContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context. {@code contextWrite}
     * propagates upstream during subscription, so call this at the end of
     * pipeline assembly.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, long runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, String.valueOf(runId)));
    }

    /** @return the run id from the context, or {@code "unknown"}; never {@code null} */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code runId} into MDC for the duration of {@code logAction}, then
     * removes it. Only use this inside logging side-effects.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
