package com.nisfix.compliance.exception;

/**
 * Thrown when a single-use secure link has already been consumed.
 */
public class AlreadyUsedException extends ComplianceException {

    public AlreadyUsedException(String message) {
        super("ALREADY_USED", message);
    }
}
