package com.nisfix.compliance.domain;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

public class User {
    private final UUID id;
    private final String email;
    private final String name;
    private final UserRole role;
    private final UUID organizationId;
    private final boolean active;
    private final OffsetDateTime lastLoginAt;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime deletedAt;

    public User(UUID id, String email, String name, UserRole role, UUID organizationId, boolean active,
                OffsetDateTime lastLoginAt, OffsetDateTime createdAt, OffsetDateTime deletedAt) {
        this.id = id;
        this.email = email;
        this.name = name;
        this.role = role;
        this.organizationId = organizationId;
        this.active = active;
        this.lastLoginAt = lastLoginAt;
        this.createdAt = createdAt;
        this.deletedAt = deletedAt;
    }

    public static User create(String email, String name, UserRole role, UUID organizationId, OffsetDateTime now) {
        return new User(UUID.randomUUID(), normalizeEmail(email), name, role, organizationId, true, null, now, null);
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public boolean canLogin() {
        return active && deletedAt == null;
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public UUID getId() { return id; }
    public String getEmail() { return email; }
    public String getName() { return name; }
    public UserRole getRole() { return role; }
    public UUID getOrganizationId() { return organizationId; }
    public boolean isActive() { return active; }
    public OffsetDateTime getLastLoginAt() { return lastLoginAt; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getDeletedAt() { return deletedAt; }
}
