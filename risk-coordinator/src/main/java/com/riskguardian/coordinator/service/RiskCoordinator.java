package com.riskguardian.coordinator.service;

import com.riskguardian.analysis.channel.AnalyzerCall;
import com.riskguardian.analysis.channel.AnalyzerChannel;
import com.riskguardian.analysis.channel.AnalyzerReply;
import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.common.model.SynthesisResult;
import com.riskguardian.common.trace.TraceContextUtil;
import com.riskguardian.coordinator.logger.AnalysisFlowLogger;
import com.riskguardian.coordinator.model.AnalysisFailure;
import com.riskguardian.coordinator.model.AnalysisOutcome;
import com.riskguardian.coordinator.model.AnalysisReport;
import com.riskguardian.coordinator.model.AnalyzeRequest;
import com.riskguardian.coordinator.model.CallOutcome;
import com.riskguardian.coordinator.model.CallStatus;
import com.riskguardian.coordinator.model.FailureCause;
import com.riskguardian.coordinator.synthesis.SynthesisEngine;
import com.riskguardian.coordinator.synthesis.SynthesisGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Fans one request out to the correlation and concentration analyzers, then synthesizes
 * whatever came back.
 *
 * <p>Each call resolves to a {@link CallOutcome} and never errors, so {@code Mono.zip} always
 * waits for both: a slow or failing analyzer never cancels the other one. The per-call timeout
 * cancels only its own subscription; the overall deadline bounds dispatch and synthesis together.
 *
 * <p>Synthesis runs on {@link Schedulers#boundedElastic()} because knowledge lookups block.
 * Nothing escapes {@link #analyze}: unexpected errors become an {@link AnalysisFailure}.
 */
public class RiskCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RiskCoordinator.class);
    private static final String COORDINATOR_NAME = "RiskCoordinator";

    private final AnalyzerChannel<CorrelationResult> correlationChannel;
    private final AnalyzerChannel<ConcentrationResult> concentrationChannel;
    private final SynthesisEngine synthesisEngine;
    private final AnalysisFlowLogger flowLogger;
    private final EngineSettings defaultSettings;

    public RiskCoordinator(
            AnalyzerChannel<CorrelationResult> correlationChannel,
            AnalyzerChannel<ConcentrationResult> concentrationChannel,
            SynthesisEngine synthesisEngine,
            AnalysisFlowLogger flowLogger,
            EngineSettings defaultSettings) {
        this.correlationChannel   = correlationChannel;
        this.concentrationChannel = concentrationChannel;
        this.synthesisEngine      = synthesisEngine;
        this.flowLogger           = flowLogger;
        this.defaultSettings      = defaultSettings;
    }

    public EngineSettings defaultSettings() {
        return defaultSettings;
    }

    public Mono<AnalysisOutcome> analyze(AnalyzeRequest request) {
        String correlationId = request.correlationId();
        EngineSettings settings = request.settings() != null ? request.settings() : defaultSettings;

        Mono<AnalysisOutcome> pipeline = Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            flowLogger.logWithCorrelationId(AnalysisFlowLogger.REQUEST_RECEIVED, correlationId);
            log.info("Analysis started. holdings={} totalValue={} windowDays={} correlationId={}",
                     request.snapshot().holdings().size(), request.snapshot().totalValue(),
                     settings.windowDays(), correlationId);

            AnalyzerCall call = new AnalyzerCall(correlationId, request.snapshot(), settings);
            Duration perCall = min(settings.perCallTimeout(), settings.overallDeadline());

            return Mono.zip(dispatch(correlationChannel, call, perCall),
                            dispatch(concentrationChannel, call, perCall))
                .doOnSubscribe(s -> flowLogger.logWithCorrelationId(
                    AnalysisFlowLogger.ANALYZERS_DISPATCHED, correlationId))
                .doOnEach(flowLogger.stage(AnalysisFlowLogger.CALLS_RESOLVED))
                .publishOn(Schedulers.boundedElastic())
                .map(calls -> assemble(correlationId, calls.getT1(), calls.getT2(), settings, startTime))
                .timeout(settings.overallDeadline())
                .onErrorResume(TimeoutException.class, e -> Mono.just(failure(correlationId, startTime,
                    new FailureCause(COORDINATOR_NAME, CallStatus.TIMED_OUT,
                        "overall deadline of " + settings.overallDeadline().toMillis() + "ms exceeded"))))
                .onErrorResume(e -> {
                    log.error("Analysis aborted unexpectedly. correlationId={}", correlationId, e);
                    return Mono.just(failure(correlationId, startTime,
                        new FailureCause(COORDINATOR_NAME, CallStatus.FAILED, String.valueOf(e.getMessage()))));
                })
                .doOnNext(outcome -> {
                    if (outcome instanceof AnalysisReport report) {
                        flowLogger.logReport(report);
                    } else if (outcome instanceof AnalysisFailure failure) {
                        flowLogger.logFailure(failure);
                    }
                });
        });

        return TraceContextUtil.withCorrelationId(pipeline, correlationId);
    }

    /** Blocks until the outcome is ready; never longer than the request's overall deadline plus scheduling. */
    public AnalysisOutcome analyzeBlocking(AnalyzeRequest request) {
        return analyze(request).block();
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    /** Outcome of one call; {@code result} is non-null only when the call succeeded. */
    private record Dispatched<T>(CallOutcome outcome, T result) {}

    private <T> Mono<Dispatched<T>> dispatch(AnalyzerChannel<T> channel, AnalyzerCall call, Duration timeout) {
        String name = channel.analyzerName();
        String correlationId = call.correlationId();
        return Mono.defer(() -> {
            final CallOutcome pending = CallOutcome.pending(name);
            final long start = System.currentTimeMillis();
            return channel.request(call)
                .timeout(timeout)
                .map(reply -> accept(pending, reply, correlationId, System.currentTimeMillis() - start))
                .switchIfEmpty(Mono.fromSupplier(() -> new Dispatched<T>(
                    pending.fail(System.currentTimeMillis() - start, "analyzer completed without a reply"), null)))
                .onErrorResume(TimeoutException.class, e -> {
                    long elapsed = System.currentTimeMillis() - start;
                    TraceContextUtil.withMdc(correlationId, () ->
                        log.warn("Analyzer timed out. analyzer={} timeoutMs={} correlationId={}",
                                 name, timeout.toMillis(), correlationId));
                    return Mono.just(new Dispatched<T>(
                        pending.timeOut(elapsed, "no reply within " + timeout.toMillis() + "ms"), null));
                })
                .onErrorResume(e -> {
                    long elapsed = System.currentTimeMillis() - start;
                    TraceContextUtil.withMdc(correlationId, () ->
                        log.error("Analyzer failed. analyzer={} correlationId={}", name, correlationId, e));
                    return Mono.just(new Dispatched<T>(pending.fail(elapsed, String.valueOf(e.getMessage())), null));
                })
                .doOnNext(dispatched -> flowLogger.logCallOutcome(dispatched.outcome(), correlationId));
        });
    }

    private <T> Dispatched<T> accept(CallOutcome pending, AnalyzerReply<T> reply, String correlationId, long elapsed) {
        if (!correlationId.equals(reply.correlationId())) {
            return new Dispatched<>(pending.fail(elapsed,
                "reply correlation id " + reply.correlationId() + " does not match request"), null);
        }
        if (reply.result() == null) {
            return new Dispatched<>(pending.fail(elapsed, "analyzer replied without a result"), null);
        }
        return new Dispatched<>(pending.succeed(elapsed, reply.origin(), reply.processingMs()), reply.result());
    }

    // ── Assembly ─────────────────────────────────────────────────────────────

    private AnalysisOutcome assemble(String correlationId,
                                     Dispatched<CorrelationResult> correlationCall,
                                     Dispatched<ConcentrationResult> concentrationCall,
                                     EngineSettings settings, long startTime) {
        CallOutcome correlationOutcome = correlationCall.outcome();
        CallOutcome concentrationOutcome = concentrationCall.outcome();

        if (!correlationOutcome.isSuccess() && !concentrationOutcome.isSuccess()) {
            return failure(correlationId, startTime,
                FailureCause.of(correlationOutcome), FailureCause.of(concentrationOutcome));
        }

        CorrelationResult correlation = correlationCall.result();
        ConcentrationResult concentration = concentrationCall.result();

        Optional<SynthesisResult> synthesis =
            SynthesisGuard.resolve(correlation, concentration, settings, synthesisEngine);
        if (synthesis.isEmpty()) {
            // at least one call replied, but only with insufficient data
            return failure(correlationId, startTime,
                unavailable(correlationOutcome, correlation == null ? null : correlation.narrative()),
                unavailable(concentrationOutcome, concentration == null ? null : concentration.narrative()));
        }

        String degradationNote = null;
        if (!SynthesisGuard.isUsable(correlation)) {
            degradationNote = unavailableNote(correlationOutcome) + "; synthesis used the concentration perspective only.";
        } else if (!SynthesisGuard.isUsable(concentration)) {
            degradationNote = unavailableNote(concentrationOutcome) + "; synthesis used the correlation perspective only.";
        }

        return new AnalysisReport(correlationId, correlation, concentration, synthesis.get(),
            List.of(correlationOutcome, concentrationOutcome), degradationNote,
            System.currentTimeMillis() - startTime);
    }

    private static AnalysisFailure failure(String correlationId, long startTime, FailureCause... causes) {
        return new AnalysisFailure(correlationId, List.of(causes), System.currentTimeMillis() - startTime);
    }

    /** A succeeded call is only unavailable because its analyzer reported insufficient data. */
    private static FailureCause unavailable(CallOutcome outcome, String narrative) {
        return outcome.isSuccess()
            ? new FailureCause(outcome.analyzerName(), outcome.status(), "insufficient data: " + narrative)
            : FailureCause.of(outcome);
    }

    private static String unavailableNote(CallOutcome outcome) {
        return outcome.isSuccess() ? outcome.analyzerName() + " returned INSUFFICIENT_DATA" : describe(outcome);
    }

    private static String describe(CallOutcome outcome) {
        return outcome.analyzerName() + " " + outcome.status() + " (" + outcome.failureMessage() + ")";
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
