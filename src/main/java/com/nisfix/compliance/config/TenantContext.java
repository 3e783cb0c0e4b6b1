package com.nisfix.compliance.config;

import java.util.UUID;

/**
 * Organization of the current request, taken from the verified JWT only.
 */
public final class TenantContext {
    private static final ThreadLocal<UUID> CURRENT = new ThreadLocal<>();

    private TenantContext() {}

    public static void setOrganizationId(UUID organizationId) {
        CURRENT.set(organizationId);
    }

    public static UUID getOrganizationId() {
        return CURRENT.get();
    }

    public static void clear() {
        CURRENT.remove();
    }
}
