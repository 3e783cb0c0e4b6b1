package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.QuestionnaireRepository;
import com.nisfix.compliance.domain.ports.RelationshipRepository;
import com.nisfix.compliance.domain.ports.RequirementRepository;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.requirement.Priority;
import com.nisfix.compliance.domain.requirement.ReportGrade;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import com.nisfix.compliance.domain.requirement.RequirementType;
import com.nisfix.compliance.exception.CannotAssignException;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

@Service
public class RequirementService {

    private static final Logger log = LoggerFactory.getLogger(RequirementService.class);

    private final RequirementRepository requirements;
    private final RelationshipRepository relationships;
    private final QuestionnaireRepository questionnaires;
    private final OrganizationRepository organizations;
    private final NotifierPort notifier;
    private final Clock clock;

    public RequirementService(RequirementRepository requirements, RelationshipRepository relationships,
                              QuestionnaireRepository questionnaires, OrganizationRepository organizations,
                              NotifierPort notifier, Clock clock) {
        this.requirements = requirements;
        this.relationships = relationships;
        this.questionnaires = questionnaires;
        this.organizations = organizations;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Assigns a requirement to the supplier of an active relationship. Questionnaire requirements
     * need a published questionnaire of the same company and inherit its passing score unless one
     * is given.
     */
    @Transactional
    public Requirement create(AuthenticatedUser caller, CreateRequirementCommand cmd) {
        UUID companyId = caller.organizationId();
        log.info("Assigning {} requirement '{}' on relationship {} by user {}",
                cmd.type(), cmd.title(), cmd.relationshipId(), caller.userId());

        Relationship relationship = relationships.findById(cmd.relationshipId())
                .filter(r -> r.getCompanyId().equals(companyId))
                .orElseThrow(() -> new NotFoundException("Relationship", cmd.relationshipId()));
        if (!relationship.canReceiveRequirements()) {
            throw new CannotAssignException("requirements can only be assigned to active suppliers");
        }

        Integer passingScore = cmd.passingScore();
        if (cmd.type() == RequirementType.QUESTIONNAIRE) {
            if (cmd.questionnaireId() == null) {
                throw new ValidationFailedException("questionnaireId is required for questionnaire requirements");
            }
            Questionnaire questionnaire = questionnaires.findById(cmd.questionnaireId())
                    .filter(q -> q.getCompanyId().equals(companyId))
                    .orElseThrow(() -> new NotFoundException("Questionnaire", cmd.questionnaireId()));
            if (!questionnaire.canBeAssigned()) {
                throw new CannotAssignException("only published questionnaires can be assigned");
            }
            if (passingScore == null) {
                passingScore = questionnaire.getPassingScore();
            }
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Requirement requirement = requirements.save(Requirement.assign(relationship.getId(), companyId,
                relationship.getSupplierId(), cmd.type(), cmd.title().trim(), cmd.description(), cmd.priority(),
                cmd.dueDate(), cmd.type() == RequirementType.QUESTIONNAIRE ? cmd.questionnaireId() : null,
                passingScore, cmd.minimumGrade(), cmd.maxReportAgeDays(), caller.userId(), now));
        log.info("Requirement {} assigned to supplier {}", requirement.getId(), requirement.getSupplierId());

        Organization company = organizations.findById(companyId).orElse(null);
        if (company == null || company.getSettings().notificationsEnabled()) {
            try {
                notifier.sendRequirementAssigned(relationship.getInvitedEmail(), requirement.getId(),
                        requirement.getTitle(), company == null ? null : company.getName(), requirement.getDueDate());
            } catch (Exception e) {
                log.error("Failed to publish assignment notice for requirement {}: {}",
                        requirement.getId(), e.getMessage(), e);
            }
        }
        return requirement;
    }

    @Transactional
    public Requirement update(AuthenticatedUser caller, UUID requirementId, UpdateRequirementCommand cmd) {
        Requirement requirement = loadForCompany(caller.organizationId(), requirementId);
        requirement.updateTerms(cmd.title(), cmd.description(), cmd.priority(), cmd.dueDate(), cmd.passingScore(),
                cmd.minimumGrade(), cmd.maxReportAgeDays(), OffsetDateTime.now(clock));
        log.info("Requirement {} updated by user {}", requirementId, caller.userId());
        return requirements.save(requirement);
    }

    @Transactional(readOnly = true)
    public RequirementView get(AuthenticatedUser caller, UUID requirementId) {
        return RequirementView.of(loadForCompany(caller.organizationId(), requirementId), OffsetDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public PageResult<RequirementView> list(AuthenticatedUser caller, RequirementStatus status, UUID relationshipId,
                                            PageQuery page) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return requirements.listByCompany(caller.organizationId(), status, relationshipId, page)
                .map(r -> RequirementView.of(r, now));
    }

    @Transactional(readOnly = true)
    public RequirementStats stats(AuthenticatedUser caller) {
        Map<RequirementStatus, Long> byStatus = requirements.countByStatus(caller.organizationId());
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        long overdue = requirements.countOverdue(caller.organizationId(), OffsetDateTime.now(clock));
        return new RequirementStats(total, byStatus, overdue);
    }

    // Supplier side

    @Transactional(readOnly = true)
    public PageResult<RequirementView> listForSupplier(AuthenticatedUser caller, RequirementStatus status,
                                                       PageQuery page) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return requirements.listBySupplier(caller.organizationId(), status, page)
                .map(r -> RequirementView.of(r, now));
    }

    @Transactional(readOnly = true)
    public RequirementView getForSupplier(AuthenticatedUser caller, UUID requirementId) {
        return RequirementView.of(loadForSupplier(caller.organizationId(), requirementId), OffsetDateTime.now(clock));
    }

    Requirement loadForCompany(UUID companyId, UUID requirementId) {
        return requirements.findById(requirementId)
                .filter(r -> r.getCompanyId().equals(companyId))
                .orElseThrow(() -> new NotFoundException("Requirement", requirementId));
    }

    Requirement loadForSupplier(UUID supplierId, UUID requirementId) {
        return requirements.findById(requirementId)
                .filter(r -> r.getSupplierId().equals(supplierId))
                .orElseThrow(() -> new NotFoundException("Requirement", requirementId));
    }

    public record CreateRequirementCommand(UUID relationshipId, RequirementType type, String title,
                                           String description, Priority priority, OffsetDateTime dueDate,
                                           UUID questionnaireId, Integer passingScore, ReportGrade minimumGrade,
                                           Integer maxReportAgeDays) {}

    /** Null fields keep the current value. */
    public record UpdateRequirementCommand(String title, String description, Priority priority,
                                           OffsetDateTime dueDate, Integer passingScore, ReportGrade minimumGrade,
                                           Integer maxReportAgeDays) {}

    public record RequirementStats(long total, Map<RequirementStatus, Long> byStatus, long overdue) {}
}
