package com.nisfix.compliance.exception;

/**
 * Thrown when an edit is attempted outside of the entity's editable window.
 */
public class NotEditableException extends ComplianceException {

    public NotEditableException(String message) {
        super("NOT_EDITABLE", message);
    }
}
