package com.nisfix.compliance.config;

import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.UserRole;

import java.util.UUID;

/**
 * Principal placed in the security context by {@link JwtAuthFilter}.
 */
public record AuthenticatedUser(UUID userId, UUID organizationId, String email, UserRole role,
                                OrganizationType organizationType) {

    public boolean isCompany() {
        return organizationType == OrganizationType.COMPANY;
    }
}
