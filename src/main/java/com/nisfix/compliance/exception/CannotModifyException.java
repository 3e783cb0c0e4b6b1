package com.nisfix.compliance.exception;

/**
 * Thrown when an entity is in a terminal or frozen state and no longer accepts updates.
 */
public class CannotModifyException extends ComplianceException {

    public CannotModifyException(String message) {
        super("CANNOT_MODIFY", message);
    }
}
