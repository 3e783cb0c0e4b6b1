package com.nisfix.compliance.exception;

/**
 * Thrown when a requirement cannot be assigned, e.g. the supplier relationship is not active
 * or the questionnaire is not published.
 */
public class CannotAssignException extends ComplianceException {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public CannotAssignException(String message) {
        super("CANNOT_ASSIGN", message);
    }
}
