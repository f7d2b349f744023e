package com.riskguardian.analysis.channel;

/**
 * Response half of an analyzer exchange.
 *
 * @param origin       identity of the endpoint that produced {@code result}
 * @param processingMs time the analyzer spent on the call, as measured by the endpoint
 */
public record AnalyzerReply<T>(
    String correlationId,
    T result,
    String origin,
    long processingMs
) {}
