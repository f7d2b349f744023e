package com.riskguardian.common.exception;

/**
 * Unexpected failure inside an analyzer. The coordinator catches it at its boundary
 * and records it as a {@code FAILED} call outcome; the analyzer name is kept for logging.
 */
public class AnalyzerException extends RuntimeException {
    private final String analyzerName;

    public AnalyzerException(String analyzerName, String message) {
        super("[" + analyzerName + "] " + message);
        this.analyzerName = analyzerName;
    }

    public AnalyzerException(String analyzerName, String message, Throwable cause) {
        super("[" + analyzerName + "] " + message, cause);
        this.analyzerName = analyzerName;
    }

    public String getAnalyzerName() {
        return analyzerName;
    }
}
