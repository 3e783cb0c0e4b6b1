package com.nisfix.compliance.domain;

/**
 * Purpose of a secure link.
 */
public enum SecureLinkType {
    /**
     * Passwordless login link
     */
    AUTH,

    /**
     * Supplier onboarding link sent with a relationship invitation
     */
    INVITATION
}
