package com.nisfix.compliance.exception;

/**
 * Thrown when a time-limited secure link is redeemed after its expiry.
 */
public class ExpiredException extends ComplianceException {

    public ExpiredException(String message) {
        super("EXPIRED", message);
    }
}
