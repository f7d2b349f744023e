package com.riskguardian.analysis.channel;

import reactor.core.publisher.Mono;

/**
 * Asynchronous request/response link to one analyzer.
 *
 * <p>The returned {@code Mono} emits one reply or errors; it is cold, and cancelling the
 * subscription abandons the in-flight request. Timeouts are the caller's concern.
 */
public interface AnalyzerChannel<T> {
    Mono<AnalyzerReply<T>> request(AnalyzerCall call);
    String analyzerName();
}
