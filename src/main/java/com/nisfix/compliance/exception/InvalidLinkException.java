package com.nisfix.compliance.exception;

/**
 * Thrown when a secure link exists but has been invalidated.
 */
public class InvalidLinkException extends ComplianceException {

    public InvalidLinkException(String message) {
        super("INVALID_LINK", message);
    }
}
