package com.nisfix.compliance.exception;

/**
 * Thrown when input is malformed or a required value is missing.
 */
public class ValidationFailedException extends ComplianceException {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public ValidationFailedException(String message) {
        super("VALIDATION_FAILED", message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public ValidationFailedException(String message, Throwable cause) {
        super("VALIDATION_FAILED", message, cause);
    }
}
