package com.nisfix.compliance.exception;

/**
 * Thrown when creating an entity would violate a uniqueness rule.
 */
public class AlreadyExistsException extends ComplianceException {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public AlreadyExistsException(String message) {
        super("ALREADY_EXISTS", message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public AlreadyExistsException(String message, Throwable cause) {
        super("ALREADY_EXISTS", message, cause);
    }
}
