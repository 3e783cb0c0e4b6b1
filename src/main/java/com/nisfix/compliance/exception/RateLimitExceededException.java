package com.nisfix.compliance.exception;

/**
 * Thrown when too many secure links were requested for one email inside the trailing window.
 */
public class RateLimitExceededException extends ComplianceException {

    private final int windowMinutes;

    public RateLimitExceededException(String message, int windowMinutes) {
        super("RATE_LIMIT_EXCEEDED", message);
        this.windowMinutes = windowMinutes;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }
}
