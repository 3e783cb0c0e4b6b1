package com.nisfix.compliance.exception;

import java.util.UUID;

/**
 * Thrown when an entity is absent or the caller's organization has no visibility of it.
 * Both cases produce the same message so ownership is never leaked.
 */
public class NotFoundException extends ComplianceException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public NotFoundException(String entity, UUID id) {
        super("NOT_FOUND", entity + " not found: " + id);
    }
}
