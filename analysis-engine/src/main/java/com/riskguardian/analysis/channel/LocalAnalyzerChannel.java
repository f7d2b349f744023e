package com.riskguardian.analysis.channel;

import com.riskguardian.analysis.analyzer.PortfolioAnalyzer;
import com.riskguardian.common.exception.AnalyzerException;
import com.riskguardian.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * In-process channel: runs the analyzer on {@link Schedulers#boundedElastic()} so that its
 * blocking knowledge lookups never occupy a non-blocking thread.
 *
 * <p>Any failure other than {@link AnalyzerException} is wrapped in one, so callers always
 * see the analyzer name on the error.
 */
public class LocalAnalyzerChannel<T> implements AnalyzerChannel<T> {

    private static final Logger log = LoggerFactory.getLogger(LocalAnalyzerChannel.class);

    private final PortfolioAnalyzer<T> analyzer;
    private final String origin;

    public LocalAnalyzerChannel(PortfolioAnalyzer<T> analyzer) {
        this.analyzer = analyzer;
        this.origin = "local://" + analyzer.analyzerName();
    }

    @Override
    public String analyzerName() {
        return analyzer.analyzerName();
    }

    @Override
    public Mono<AnalyzerReply<T>> request(AnalyzerCall call) {
        return Mono.fromCallable(() -> {
                long start = System.currentTimeMillis();
                T result = analyzer.analyze(call.snapshot(), call.settings());
                long processingMs = System.currentTimeMillis() - start;
                TraceContextUtil.withMdc(call.correlationId(), () ->
                    log.info("Analyzer={} replied. origin={} processingMs={}",
                             analyzer.analyzerName(), origin, processingMs));
                return new AnalyzerReply<>(call.correlationId(), result, origin, processingMs);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(e -> !(e instanceof AnalyzerException),
                e -> new AnalyzerException(analyzer.analyzerName(), "analysis failed: " + e.getMessage(), e));
    }
}
