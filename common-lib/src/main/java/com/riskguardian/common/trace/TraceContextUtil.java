package com.riskguardian.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the caller's correlation id through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the correlation id inside a
 * pipeline. MDC is only written as a temporary bridge around a log statement, never as
 * a persistent ThreadLocal store, because analyzer work hops between scheduler threads.
 *
 * <pre>
 *     return TraceContextUtil.withCorrelationId(pipeline, request.correlationId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String CORRELATION_ID_KEY = "correlationId";

    private TraceContextUtil() {}

    /**
     * Stores {@code correlationId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} propagates upstream during subscription.
     */
    public static <T> Mono<T> withCorrelationId(Mono<T> mono, String correlationId) {
        return mono.contextWrite(ctx -> ctx.put(CORRELATION_ID_KEY, correlationId));
    }

    /** Returns the correlation id from {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String getCorrelationId(ContextView ctx) {
        return ctx.getOrDefault(CORRELATION_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code correlationId} into MDC for the duration of {@code logAction} only.
     *
     * @param correlationId the id to expose as {@code %X{correlationId}}
     * @param logAction     the log statement(s) to run
     */
    public static void withMdc(String correlationId, Runnable logAction) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
        try {
            logAction.run();
        } finally {
            MDC.remove(CORRELATION_ID_KEY);
        }
    }
}
