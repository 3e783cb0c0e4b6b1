package com.nisfix.compliance.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Single-use secure link sent by email, either for login or for supplier onboarding.
 */
public class SecureLink {
    private final UUID id;
    private final String identifier;
    private final SecureLinkType type;
    private final String email;
    private final UUID userId;
    private final UUID relationshipId;
    private final OffsetDateTime expiresAt;
    private final boolean valid;
    private final OffsetDateTime usedAt;
    private final OffsetDateTime createdAt;

    public SecureLink(UUID id, String identifier, SecureLinkType type, String email, UUID userId,
                      UUID relationshipId, OffsetDateTime expiresAt, boolean valid,
                      OffsetDateTime usedAt, OffsetDateTime createdAt) {
        this.id = id;
        this.identifier = identifier;
        this.type = type;
        this.email = email;
        this.userId = userId;
        this.relationshipId = relationshipId;
        this.expiresAt = expiresAt;
        this.valid = valid;
        this.usedAt = usedAt;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public String getIdentifier() { return identifier; }
    public SecureLinkType getType() { return type; }
    public String getEmail() { return email; }
    public UUID getUserId() { return userId; }
    public UUID getRelationshipId() { return relationshipId; }
    public OffsetDateTime getExpiresAt() { return expiresAt; }
    public boolean isValid() { return valid; }
    public OffsetDateTime getUsedAt() { return usedAt; }
    public OffsetDateTime getCreatedAt() { return createdAt; }

    // Business logic methods
    public boolean isExpired(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isUsed() {
        return usedAt != null;
    }

    public boolean isUsable(OffsetDateTime now) {
        return valid && usedAt == null && !isExpired(now);
    }
}
