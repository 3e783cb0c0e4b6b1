package com.nisfix.compliance.domain;

/**
 * Role of a user inside their own organization.
 */
public enum UserRole {
    /**
     * Full access, including all state-changing operations
     */
    ADMIN,

    /**
     * Read-only access
     */
    VIEWER
}
