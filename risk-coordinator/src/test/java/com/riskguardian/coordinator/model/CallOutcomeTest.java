package com.riskguardian.coordinator.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallOutcomeTest {

    private final CallOutcome pending = CallOutcome.pending("CorrelationAnalyzer");

    @Test
    @DisplayName("every call starts PENDING with no timing or origin")
    void startsPending() {
        assertEquals(CallStatus.PENDING, pending.status());
        assertEquals(0L, pending.durationMs());
        assertNull(pending.origin());
        assertFalse(pending.isSuccess());
    }

    @Test
    @DisplayName("PENDING → SUCCEEDED keeps the name and records origin and processing time")
    void succeed() {
        CallOutcome done = pending.succeed(42, "local://CorrelationAnalyzer", 40);

        assertEquals("CorrelationAnalyzer", done.analyzerName());
        assertEquals(CallStatus.SUCCEEDED, done.status());
        assertEquals(42L, done.durationMs());
        assertEquals(Long.valueOf(40L), done.processingMs());
        assertNull(done.failureMessage());
        assertTrue(done.isSuccess());
    }

    @Test
    @DisplayName("PENDING → TIMED_OUT and PENDING → FAILED carry a message, no origin")
    void unsuccessfulTransitions() {
        CallOutcome timedOut = pending.timeOut(300, "no reply within 300ms");
        CallOutcome failed = pending.fail(12, "price feed offline");

        assertEquals(CallStatus.TIMED_OUT, timedOut.status());
        assertEquals("no reply within 300ms", timedOut.failureMessage());
        assertNull(timedOut.origin());
        assertEquals(CallStatus.FAILED, failed.status());
        assertNull(failed.processingMs());
    }

    @Test
    @DisplayName("a terminal outcome cannot move again")
    void terminalIsFinal() {
        CallOutcome done = pending.succeed(42, "local://CorrelationAnalyzer", 40);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> done.fail(50, "late"));
        assertTrue(error.getMessage().contains("already SUCCEEDED"));
        assertThrows(IllegalStateException.class, () -> pending.fail(1, "x").timeOut(2, "y"));
    }
}
