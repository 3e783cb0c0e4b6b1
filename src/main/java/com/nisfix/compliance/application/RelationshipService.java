package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.RelationshipRepository;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.relationship.RelationshipStatus;
import com.nisfix.compliance.domain.relationship.SupplierClassification;
import com.nisfix.compliance.exception.AlreadyExistsException;
import com.nisfix.compliance.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Company-supplier relationships. Company-side operations only see relationships of the
 * caller's organization; anything else is reported as not found.
 */
@Service
public class RelationshipService {

    private static final Logger log = LoggerFactory.getLogger(RelationshipService.class);

    private final RelationshipRepository relationships;
    private final OrganizationRepository organizations;
    private final TokenIssuer tokenIssuer;
    private final NotifierPort notifier;
    private final AppProperties props;
    private final Clock clock;

    public RelationshipService(RelationshipRepository relationships, OrganizationRepository organizations,
                               TokenIssuer tokenIssuer, NotifierPort notifier, AppProperties props, Clock clock) {
        this.relationships = relationships;
        this.organizations = organizations;
        this.tokenIssuer = tokenIssuer;
        this.notifier = notifier;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    public Relationship invite(AuthenticatedUser caller, InviteSupplierCommand cmd) {
        String email = User.normalizeEmail(cmd.email());
        log.info("Inviting supplier {} to company {} by user {}", email, caller.organizationId(), caller.userId());

        if (relationships.existsOpen(caller.organizationId(), email)) {
            throw new AlreadyExistsException("a relationship with this supplier already exists");
        }

        Relationship relationship = relationships.save(Relationship.invite(caller.organizationId(), email,
                caller.userId(), cmd.classification(), cmd.notes(), cmd.servicesProvided(), cmd.contractRef(),
                OffsetDateTime.now(clock)));

        try {
            SecureLink link = tokenIssuer.issueInvitationLink(email, relationship.getId());
            String companyName = organizations.findById(caller.organizationId())
                    .map(Organization::getName).orElse("A company");
            notifier.sendSupplierInvitation(email, companyName, invitationUrl(link), link.getExpiresAt());
            log.info("Published invitation for relationship {}", relationship.getId());
        } catch (Exception e) {
            log.error("Failed to send invitation for relationship {}: {}", relationship.getId(), e.getMessage(), e);
        }
        return relationship;
    }

    private String invitationUrl(SecureLink link) {
        return AuthService.trimTrailingSlash(props.getInvitation().getBaseUrl())
                + "/auth/invitation/" + link.getIdentifier();
    }

    @Transactional(readOnly = true)
    public Relationship get(AuthenticatedUser caller, UUID relationshipId) {
        return loadOwned(caller.organizationId(), relationshipId);
    }

    @Transactional(readOnly = true)
    public PageResult<Relationship> list(AuthenticatedUser caller, RelationshipStatus status,
                                         SupplierClassification classification, PageQuery page) {
        return relationships.listByCompany(caller.organizationId(), status, classification, page);
    }

    @Transactional(readOnly = true)
    public RelationshipStats stats(AuthenticatedUser caller) {
        Map<RelationshipStatus, Long> byStatus = new EnumMap<>(RelationshipStatus.class);
        for (RelationshipStatus s : RelationshipStatus.values()) byStatus.put(s, 0L);
        byStatus.putAll(relationships.countByStatus(caller.organizationId()));

        Map<SupplierClassification, Long> byClassification = new EnumMap<>(SupplierClassification.class);
        for (SupplierClassification c : SupplierClassification.values()) byClassification.put(c, 0L);
        byClassification.putAll(relationships.countByClassification(caller.organizationId()));

        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new RelationshipStats(total, byStatus, byClassification);
    }

    @Transactional
    public Relationship updateDetails(AuthenticatedUser caller, UUID relationshipId, String notes,
                                      List<String> servicesProvided, String contractRef) {
        Relationship relationship = loadOwned(caller.organizationId(), relationshipId);
        relationship.updateDetails(notes, servicesProvided, contractRef, OffsetDateTime.now(clock));
        return relationships.save(relationship);
    }

    @Transactional
    public Relationship updateClassification(AuthenticatedUser caller, UUID relationshipId,
                                             SupplierClassification classification) {
        Relationship relationship = loadOwned(caller.organizationId(), relationshipId);
        relationship.updateClassification(classification, OffsetDateTime.now(clock));
        log.info("Relationship {} classified as {} by user {}", relationshipId, classification, caller.userId());
        return relationships.save(relationship);
    }

    @Transactional
    public Relationship suspend(AuthenticatedUser caller, UUID relationshipId, String reason) {
        Relationship relationship = loadOwned(caller.organizationId(), relationshipId);
        relationship.suspend(caller.userId(), reason, OffsetDateTime.now(clock));
        log.info("Relationship {} suspended by user {}", relationshipId, caller.userId());
        return relationships.save(relationship);
    }

    @Transactional
    public Relationship reactivate(AuthenticatedUser caller, UUID relationshipId, String reason) {
        Relationship relationship = loadOwned(caller.organizationId(), relationshipId);
        relationship.reactivate(caller.userId(), reason, OffsetDateTime.now(clock));
        log.info("Relationship {} reactivated by user {}", relationshipId, caller.userId());
        return relationships.save(relationship);
    }

    @Transactional
    public Relationship terminate(AuthenticatedUser caller, UUID relationshipId, String reason) {
        Relationship relationship = loadOwned(caller.organizationId(), relationshipId);
        relationship.terminate(caller.userId(), reason, OffsetDateTime.now(clock));
        log.info("Relationship {} terminated by user {}", relationshipId, caller.userId());
        return relationships.save(relationship);
    }

    // Supplier side

    @Transactional(readOnly = true)
    public List<Relationship> pendingInvitations(AuthenticatedUser caller) {
        return relationships.findPendingByEmail(User.normalizeEmail(caller.email()));
    }

    @Transactional
    public Relationship accept(AuthenticatedUser caller, UUID relationshipId) {
        Relationship relationship = loadInvitation(caller, relationshipId);
        relationship.accept(caller.organizationId(), caller.userId(), OffsetDateTime.now(clock));
        log.info("Supplier {} accepted relationship {}", caller.organizationId(), relationshipId);
        return relationships.save(relationship);
    }

    @Transactional
    public Relationship decline(AuthenticatedUser caller, UUID relationshipId, String reason) {
        Relationship relationship = loadInvitation(caller, relationshipId);
        relationship.decline(caller.userId(), reason, OffsetDateTime.now(clock));
        log.info("Supplier {} declined relationship {}", caller.organizationId(), relationshipId);
        return relationships.save(relationship);
    }

    Relationship loadOwned(UUID companyId, UUID relationshipId) {
        return relationships.findById(relationshipId)
                .filter(r -> r.getCompanyId().equals(companyId))
                .orElseThrow(() -> new NotFoundException("Relationship", relationshipId));
    }

    private Relationship loadInvitation(AuthenticatedUser caller, UUID relationshipId) {
        if (caller.organizationType() != OrganizationType.SUPPLIER) {
            throw new NotFoundException("Relationship", relationshipId);
        }
        String email = User.normalizeEmail(caller.email());
        return relationships.findById(relationshipId)
                .filter(r -> r.getInvitedEmail().equals(email))
                .orElseThrow(() -> new NotFoundException("Relationship", relationshipId));
    }

    public record InviteSupplierCommand(String email, SupplierClassification classification, String notes,
                                        List<String> servicesProvided, String contractRef) {}

    public record RelationshipStats(long total, Map<RelationshipStatus, Long> byStatus,
                                    Map<SupplierClassification, Long> byClassification) {}
}
