package com.nisfix.compliance.exception;

/**
 * Thrown when approve, reject or request-revision is attempted on a requirement
 * that is not awaiting review.
 */
public class CannotReviewException extends ComplianceException {

    public CannotReviewException(String message) {
        super("CANNOT_REVIEW", message);
    }
}
