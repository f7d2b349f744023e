package com.riskguardian.knowledge;

/**
 * Raised by a knowledge backend that cannot answer a lookup. Never leaves the
 * knowledge module: {@link FailoverKnowledgeStore} converts it into a fallback or an
 * empty result.
 */
public class KnowledgeLookupException extends RuntimeException {

    public KnowledgeLookupException(String message) {
        super(message);
    }

    public KnowledgeLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
