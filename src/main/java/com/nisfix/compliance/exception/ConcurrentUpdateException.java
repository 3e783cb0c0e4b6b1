package com.nisfix.compliance.exception;

/**
 * Thrown when a conditional write matched no row because another request changed
 * the entity between our read and our write. Callers may retry.
 */
public class ConcurrentUpdateException extends ComplianceException {

    public ConcurrentUpdateException(String message) {
        super("CONCURRENT_UPDATE", message);
    }

    public ConcurrentUpdateException(String message, Throwable cause) {
        super("CONCURRENT_UPDATE", message, cause);
    }
}
