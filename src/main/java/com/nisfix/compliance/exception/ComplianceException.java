package com.nisfix.compliance.exception;

/**
 * Base type for every business failure raised by the compliance services.
 * Each subclass carries a stable, machine-readable error code that the
 * {@link GlobalExceptionHandler} exposes to API clients.
 */
public abstract class ComplianceException extends RuntimeException {

    private final String errorCode;

    /**
     * Constructs a new compliance exception with the given error code and detail message.
     *
     * @param errorCode the stable error code
     * @param message the detail message
     */
    protected ComplianceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new compliance exception with the given error code, detail message and cause.
     *
     * @param errorCode the stable error code
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    protected ComplianceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
