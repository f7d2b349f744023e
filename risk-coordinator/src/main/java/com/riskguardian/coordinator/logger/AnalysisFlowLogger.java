package com.riskguardian.coordinator.logger;

import com.riskguardian.common.trace.TraceContextUtil;
import com.riskguardian.coordinator.model.AnalysisFailure;
import com.riskguardian.coordinator.model.AnalysisReport;
import com.riskguardian.coordinator.model.CallOutcome;
import com.riskguardian.coordinator.model.FailureCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the lifecycle of one analysis request.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}    : request accepted, correlation id assigned</li>
 *   <li>{@link #ANALYZERS_DISPATCHED}: both analyzer calls subscribed</li>
 *   <li>{@link #CALL_COMPLETED}      : one analyzer call reached a terminal status</li>
 *   <li>{@link #CALLS_RESOLVED}      : both calls terminal, synthesis about to start</li>
 *   <li>{@link #SYNTHESIS_COMPLETED} : combined judgment produced</li>
 *   <li>{@link #REPORT_ASSEMBLED}    : report handed back to the caller</li>
 *   <li>{@link #ANALYSIS_FAILED}     : no usable perspective, or deadline exceeded</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the correlation id from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.CALLS_RESOLVED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String ANALYZERS_DISPATCHED = "ANALYZERS_DISPATCHED";
    public static final String CALL_COMPLETED       = "CALL_COMPLETED";
    public static final String CALLS_RESOLVED       = "CALLS_RESOLVED";
    public static final String SYNTHESIS_COMPLETED  = "SYNTHESIS_COMPLETED";
    public static final String REPORT_ASSEMBLED     = "REPORT_ASSEMBLED";
    public static final String ANALYSIS_FAILED      = "ANALYSIS_FAILED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The correlation id comes from the signal's Reactor Context, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String correlationId = TraceContextUtil.getCorrelationId(signal.getContextView());
            logWithCorrelationId(stageName, correlationId);
        };
    }

    public void logWithCorrelationId(String stageName, String correlationId) {
        TraceContextUtil.withMdc(correlationId, () ->
            log.info("[AnalysisFlow] stage={} correlationId={}", stageName, correlationId)
        );
    }

    /** Logs one analyzer call: coordinator-side duration plus the origin that answered it. */
    public void logCallOutcome(CallOutcome outcome, String correlationId) {
        TraceContextUtil.withMdc(correlationId, () ->
            log.info("[AnalysisFlow] stage={} analyzer={} status={} durationMs={} origin={} processingMs={} "
                     + "correlationId={}",
                     CALL_COMPLETED, outcome.analyzerName(), outcome.status(), outcome.durationMs(),
                     outcome.origin() != null ? outcome.origin() : "N/A",
                     outcome.processingMs() != null ? outcome.processingMs() : "N/A",
                     correlationId)
        );
    }

    /** Logs the synthesis outcome, then the assembled report. */
    public void logReport(AnalysisReport report) {
        TraceContextUtil.withMdc(report.correlationId(), () -> {
            log.info("[AnalysisFlow] stage={} overallRiskLevel={} compounding={} riskMultiplier={} "
                     + "validated={} degraded={} recommendations={} correlationId={}",
                     SYNTHESIS_COMPLETED,
                     report.synthesis().overallRiskLevel(), report.synthesis().compoundingDetected(),
                     report.synthesis().riskMultiplier(), report.synthesis().multiplierValidated(),
                     report.synthesis().degraded(), report.synthesis().recommendations().size(),
                     report.correlationId());
            log.info("[AnalysisFlow] stage={} totalDurationMs={} degradationNote={} correlationId={}",
                     REPORT_ASSEMBLED, report.totalDurationMs(),
                     report.degradationNote() != null ? report.degradationNote() : "none",
                     report.correlationId());
        });
    }

    public void logFailure(AnalysisFailure failure) {
        TraceContextUtil.withMdc(failure.correlationId(), () -> {
            for (FailureCause cause : failure.causes()) {
                log.warn("[AnalysisFlow] stage={} source={} status={} message={} correlationId={}",
                         ANALYSIS_FAILED, cause.source(), cause.status(), cause.message(),
                         failure.correlationId());
            }
        });
    }
}
