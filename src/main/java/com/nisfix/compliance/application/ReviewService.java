package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.RelationshipRepository;
import com.nisfix.compliance.domain.ports.RequirementRepository;
import com.nisfix.compliance.domain.ports.ResponseRepository;
import com.nisfix.compliance.domain.ports.SubmissionRepository;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.requirement.ReportGrade;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.response.QuestionnaireSubmission;
import com.nisfix.compliance.domain.response.SupplierResponse;
import com.nisfix.compliance.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Company review of submitted requirements. Override score and grade are stored on the response
 * for reference only; the decision is the reviewer's.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final RequirementService requirementService;
    private final RequirementRepository requirements;
    private final ResponseRepository responses;
    private final SubmissionRepository submissions;
    private final RelationshipRepository relationships;
    private final OrganizationRepository organizations;
    private final NotifierPort notifier;
    private final Clock clock;

    public ReviewService(RequirementService requirementService, RequirementRepository requirements,
                         ResponseRepository responses, SubmissionRepository submissions,
                         RelationshipRepository relationships, OrganizationRepository organizations,
                         NotifierPort notifier, Clock clock) {
        this.requirementService = requirementService;
        this.requirements = requirements;
        this.responses = responses;
        this.submissions = submissions;
        this.relationships = relationships;
        this.organizations = organizations;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ReviewView reviewView(AuthenticatedUser caller, UUID requirementId) {
        Requirement requirement = requirementService.loadForCompany(caller.organizationId(), requirementId);
        SupplierResponse response = latestSubmitted(requirement);
        QuestionnaireSubmission submission = response.getSubmissionId() == null ? null
                : submissions.findById(response.getSubmissionId()).orElse(null);
        return new ReviewView(RequirementView.of(requirement, OffsetDateTime.now(clock)), response, submission);
    }

    @Transactional
    public Requirement approve(AuthenticatedUser caller, UUID requirementId, ReviewCommand cmd) {
        Requirement requirement = requirementService.loadForCompany(caller.organizationId(), requirementId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        requirement.approve(caller.userId(), cmd.notes(), now);
        return complete(caller, requirement, cmd.notes(), cmd, now);
    }

    @Transactional
    public Requirement reject(AuthenticatedUser caller, UUID requirementId, ReviewCommand cmd) {
        Requirement requirement = requirementService.loadForCompany(caller.organizationId(), requirementId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        requirement.reject(caller.userId(), cmd.reason(), now);
        return complete(caller, requirement, cmd.reason(), cmd, now);
    }

    @Transactional
    public Requirement requestRevision(AuthenticatedUser caller, UUID requirementId, ReviewCommand cmd) {
        Requirement requirement = requirementService.loadForCompany(caller.organizationId(), requirementId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        requirement.requestRevision(caller.userId(), cmd.reason(), now);
        return complete(caller, requirement, cmd.reason(), cmd, now);
    }

    private Requirement complete(AuthenticatedUser caller, Requirement requirement, String reason,
                                 ReviewCommand cmd, OffsetDateTime now) {
        Requirement saved = requirements.save(requirement);

        responses.findLatestByRequirement(requirement.getId())
                .filter(SupplierResponse::isSubmitted)
                .ifPresent(response -> {
                    response.markReviewed(caller.userId(), reason, cmd.overrideScore(), cmd.overrideGrade(), now);
                    responses.save(response);
                });
        log.info("Requirement {} reviewed by user {}: {}", requirement.getId(), caller.userId(), saved.getStatus());

        boolean notify = organizations.findById(caller.organizationId())
                .map(Organization::getSettings)
                .map(s -> s.notificationsEnabled())
                .orElse(true);
        if (notify) {
            try {
                String recipient = relationships.findById(requirement.getRelationshipId())
                        .map(Relationship::getInvitedEmail)
                        .orElse(null);
                if (recipient != null) {
                    notifier.sendReviewOutcome(recipient, saved.getId(), saved.getTitle(), saved.getStatus(), reason);
                }
            } catch (Exception e) {
                log.error("Failed to publish review outcome for requirement {}: {}",
                        requirement.getId(), e.getMessage(), e);
            }
        }
        return saved;
    }

    private SupplierResponse latestSubmitted(Requirement requirement) {
        return responses.findLatestByRequirement(requirement.getId())
                .filter(SupplierResponse::isSubmitted)
                .orElseThrow(() -> new NotFoundException("no submission for requirement " + requirement.getId()));
    }

    /** {@code reason} is required for reject and request-revision; {@code notes} is used on approval. */
    public record ReviewCommand(String notes, String reason, Integer overrideScore, ReportGrade overrideGrade) {}

    public record ReviewView(RequirementView requirement, SupplierResponse response,
                             QuestionnaireSubmission submission) {}
}
