package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface SecureLinkRepository {
    SecureLink save(SecureLink link);

    Optional<SecureLink> findByIdentifier(String identifier);

    /**
     * Marks the link used if and only if it is still valid and unused.
     *
     * @return false when another caller consumed it first
     */
    boolean consume(String identifier, OffsetDateTime usedAt);

    int invalidateActive(String email, SecureLinkType type);

    long countCreatedSince(String email, SecureLinkType type, OffsetDateTime since);

    int deleteExpiredBefore(OffsetDateTime cutoff);
}
