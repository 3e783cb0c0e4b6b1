package com.nisfix.compliance.exception;

/**
 * Thrown when a refresh token is missing, malformed, expired or of the wrong type.
 */
public class InvalidTokenException extends ComplianceException {

    public InvalidTokenException(String message) {
        super("INVALID_TOKEN", message);
    }
}
