package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.domain.ports.SecureLinkRepository;
import com.nisfix.compliance.infrastructure.jpa.SecureLinkEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringSecureLinkRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

@Component
public class JpaSecureLinkRepositoryAdapter implements SecureLinkRepository {
    private final SpringSecureLinkRepository links;

    public JpaSecureLinkRepositoryAdapter(SpringSecureLinkRepository links) {
        this.links = links;
    }

    @Override
    public SecureLink save(SecureLink link) {
        SecureLinkEntity e = new SecureLinkEntity();
        e.setId(link.getId());
        e.setIdentifier(link.getIdentifier());
        e.setType(link.getType().name());
        e.setEmail(link.getEmail());
        e.setUserId(link.getUserId());
        e.setRelationshipId(link.getRelationshipId());
        e.setExpiresAt(link.getExpiresAt());
        e.setValid(link.isValid());
        e.setUsedAt(link.getUsedAt());
        e.setCreatedAt(link.getCreatedAt());
        links.save(e);
        return link;
    }

    @Override
    public Optional<SecureLink> findByIdentifier(String identifier) {
        return links.findByIdentifier(identifier).map(JpaSecureLinkRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional
    public boolean consume(String identifier, OffsetDateTime usedAt) {
        return links.consume(identifier, usedAt) == 1;
    }

    // Own transaction; failures do not roll back the caller.
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int invalidateActive(String email, SecureLinkType type) {
        return links.invalidateActive(email, type.name());
    }

    @Override
    public long countCreatedSince(String email, SecureLinkType type, OffsetDateTime since) {
        return links.countByEmailAndTypeAndCreatedAtAfter(email, type.name(), since);
    }

    @Override
    @Transactional
    public int deleteExpiredBefore(OffsetDateTime cutoff) {
        return links.deleteExpiredBefore(cutoff);
    }

    private static SecureLink toDomain(SecureLinkEntity e) {
        return new SecureLink(e.getId(), e.getIdentifier(), SecureLinkType.valueOf(e.getType()), e.getEmail(),
                e.getUserId(), e.getRelationshipId(), e.getExpiresAt(), e.isValid(), e.getUsedAt(),
                e.getCreatedAt());
    }
}
