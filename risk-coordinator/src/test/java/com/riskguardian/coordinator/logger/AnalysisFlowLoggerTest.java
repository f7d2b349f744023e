package com.riskguardian.coordinator.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.riskguardian.common.trace.TraceContextUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisFlowLoggerTest {

    private final AnalysisFlowLogger flowLogger = new AnalysisFlowLogger();
    private final Logger logbackLogger = (Logger) LoggerFactory.getLogger(AnalysisFlowLogger.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logbackLogger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logbackLogger.detachAppender(appender);
        appender.stop();
    }

    private List<String> messages() {
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    }

    @Test
    @DisplayName("stage() logs once on onNext with the correlation id from Reactor Context")
    void stageReadsContext() {
        Mono<String> pipeline = Mono.just("calls")
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.CALLS_RESOLVED));

        StepVerifier.create(TraceContextUtil.withCorrelationId(pipeline, "corr-42"))
            .expectNext("calls")
            .verifyComplete();

        assertEquals(List.of("[AnalysisFlow] stage=CALLS_RESOLVED correlationId=corr-42"), messages());
        assertEquals("corr-42", appender.list.get(0).getMDCPropertyMap().get(TraceContextUtil.CORRELATION_ID_KEY));
    }

    @Test
    @DisplayName("stage() without a correlation id in context logs 'unknown'")
    void stageWithoutContext() {
        StepVerifier.create(Mono.just(1).doOnEach(flowLogger.stage(AnalysisFlowLogger.CALLS_RESOLVED)))
            .expectNext(1)
            .verifyComplete();

        assertEquals(List.of("[AnalysisFlow] stage=CALLS_RESOLVED correlationId=unknown"), messages());
    }

    @Test
    @DisplayName("stage() ignores error signals")
    void stageIgnoresErrors() {
        StepVerifier.create(Mono.<String>error(new IllegalStateException("boom"))
                .doOnEach(flowLogger.stage(AnalysisFlowLogger.CALLS_RESOLVED)))
            .expectError(IllegalStateException.class)
            .verify();

        assertTrue(messages().isEmpty());
    }
}
