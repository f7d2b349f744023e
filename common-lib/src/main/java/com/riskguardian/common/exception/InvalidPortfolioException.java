package com.riskguardian.common.exception;

/**
 * Raised when a holding or portfolio snapshot fails validation at construction time.
 */
public class InvalidPortfolioException extends RuntimeException {

    public InvalidPortfolioException(String message) {
        super(message);
    }
}
