package com.nisfix.compliance.exception;

/**
 * Thrown when a requested status change is not permitted from the entity's current status.
 */
public class InvalidTransitionException extends ComplianceException {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public InvalidTransitionException(String message, Throwable cause) {
        super("INVALID_TRANSITION", message, cause);
    }
}
