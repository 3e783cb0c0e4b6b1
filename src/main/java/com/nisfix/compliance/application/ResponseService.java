package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.ports.QuestionRepository;
import com.nisfix.compliance.domain.ports.QuestionnaireRepository;
import com.nisfix.compliance.domain.ports.RequirementRepository;
import com.nisfix.compliance.domain.ports.ResponseRepository;
import com.nisfix.compliance.domain.ports.SubmissionRepository;
import com.nisfix.compliance.domain.questionnaire.Question;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.requirement.ReportGrade;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import com.nisfix.compliance.domain.requirement.RequirementType;
import com.nisfix.compliance.domain.response.DocumentReport;
import com.nisfix.compliance.domain.response.DraftAnswer;
import com.nisfix.compliance.domain.response.QuestionnaireSubmission;
import com.nisfix.compliance.domain.response.SupplierResponse;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Supplier side of a requirement: starting work, saving drafts and submitting answers or a
 * security report. Every call is scoped to the caller's supplier organization.
 */
@Service
public class ResponseService {

    private static final Logger log = LoggerFactory.getLogger(ResponseService.class);

    private final RequirementService requirementService;
    private final RequirementRepository requirements;
    private final ResponseRepository responses;
    private final SubmissionRepository submissions;
    private final QuestionnaireRepository questionnaires;
    private final QuestionRepository questions;
    private final SubmissionScorer scorer;
    private final Clock clock;

    public ResponseService(RequirementService requirementService, RequirementRepository requirements,
                           ResponseRepository responses, SubmissionRepository submissions,
                           QuestionnaireRepository questionnaires, QuestionRepository questions,
                           SubmissionScorer scorer, Clock clock) {
        this.requirementService = requirementService;
        this.requirements = requirements;
        this.responses = responses;
        this.submissions = submissions;
        this.questionnaires = questionnaires;
        this.questions = questions;
        this.scorer = scorer;
        this.clock = clock;
    }

    /**
     * Moves a pending requirement (or one sent back for revision) to IN_PROGRESS and returns the
     * open response, creating it when the latest one was already submitted. Calling it again
     * while the requirement is in progress returns the same response.
     */
    @Transactional
    public SupplierResponse start(AuthenticatedUser caller, UUID requirementId) {
        Requirement requirement = requirementService.loadForSupplier(caller.organizationId(), requirementId);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (requirement.getStatus() != RequirementStatus.IN_PROGRESS) {
            requirement.start(caller.userId(), now);
            requirements.save(requirement);
            log.info("Requirement {} started by user {}", requirementId, caller.userId());
        }

        Optional<SupplierResponse> latest = responses.findLatestByRequirement(requirementId);
        if (latest.isPresent() && !latest.get().isSubmitted()) {
            return latest.get();
        }
        SupplierResponse response = responses.save(SupplierResponse.open(requirementId, caller.organizationId(), now));
        log.info("Opened response {} for requirement {}", response.getId(), requirementId);
        return response;
    }

    @Transactional(readOnly = true)
    public SupplierResponse get(AuthenticatedUser caller, UUID responseId) {
        return loadOwned(caller.organizationId(), responseId);
    }

    @Transactional
    public SupplierResponse saveDraft(AuthenticatedUser caller, UUID responseId, List<AnswerInput> answers) {
        SupplierResponse response = loadOwned(caller.organizationId(), responseId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (AnswerInput answer : answers) {
            response.saveDraft(new DraftAnswer(answer.questionId(), answer.selectedOptions(), answer.textAnswer(), now));
        }
        log.debug("Saved {} draft answers on response {}", answers.size(), responseId);
        return responses.save(response);
    }

    /**
     * Scores the answers, stores the immutable submission and moves the requirement to SUBMITTED.
     */
    @Transactional
    public SubmissionOutcome submitQuestionnaire(AuthenticatedUser caller, UUID responseId,
                                                 List<AnswerInput> answers) {
        SupplierResponse response = loadOwned(caller.organizationId(), responseId);
        Requirement requirement = requirementService.loadForSupplier(caller.organizationId(),
                response.getRequirementId());
        if (requirement.getType() != RequirementType.QUESTIONNAIRE) {
            throw new ValidationFailedException("this requirement expects a document report");
        }
        if (answers == null || answers.isEmpty()) {
            throw new ValidationFailedException("at least one answer is required");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        requirement.submit(caller.userId(), now);

        Questionnaire questionnaire = questionnaires.findById(requirement.getQuestionnaireId())
                .orElseThrow(() -> new NotFoundException("Questionnaire", requirement.getQuestionnaireId()));
        List<Question> questionList = questions.listByQuestionnaire(questionnaire.getId());
        for (AnswerInput answer : answers) {
            questionList.stream()
                    .filter(q -> q.getId().equals(answer.questionId()))
                    .findFirst()
                    .ifPresent(q -> q.validateAnswer(answer.selectedOptions(), answer.textAnswer()));
        }

        QuestionnaireSubmission submission = submissions.save(
                scorer.score(requirement, questionnaire, questionList, response, answers, now));
        response.recordSubmission(submission, now);
        SupplierResponse savedResponse = responses.save(response);
        Requirement savedRequirement = requirements.save(requirement);

        log.info("Response {} submitted for requirement {}: score {}/{}, passed {}", responseId,
                requirement.getId(), submission.getTotalScore(), submission.getMaxPossibleScore(),
                submission.isPassed());
        return new SubmissionOutcome(RequirementView.of(savedRequirement, now), savedResponse, submission);
    }

    /**
     * Records a security report for a document requirement. The report passes when its grade
     * meets the requirement's minimum and it is not older than the allowed age.
     */
    @Transactional
    public SubmissionOutcome submitDocument(AuthenticatedUser caller, UUID responseId, ReportGrade grade,
                                            LocalDate reportDate, String reference) {
        SupplierResponse response = loadOwned(caller.organizationId(), responseId);
        Requirement requirement = requirementService.loadForSupplier(caller.organizationId(),
                response.getRequirementId());
        if (requirement.getType() != RequirementType.DOCUMENT) {
            throw new ValidationFailedException("this requirement expects questionnaire answers");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        requirement.submit(caller.userId(), now);

        DocumentReport report = new DocumentReport(grade, reportDate, reference);
        ReportGrade minimum = requirement.getMinimumGrade() != null
                ? requirement.getMinimumGrade() : Requirement.DEFAULT_MINIMUM_GRADE;
        int maxAge = requirement.getMaxReportAgeDays() != null
                ? requirement.getMaxReportAgeDays() : Requirement.DEFAULT_MAX_REPORT_AGE_DAYS;
        boolean passed = report.satisfies(minimum, maxAge, now.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate());

        response.recordDocumentReport(report, passed, now);
        SupplierResponse savedResponse = responses.save(response);
        Requirement savedRequirement = requirements.save(requirement);
        log.info("Document report {} (grade {}) submitted for requirement {}: passed {}",
                reference, grade, requirement.getId(), passed);
        return new SubmissionOutcome(RequirementView.of(savedRequirement, now), savedResponse, null);
    }

    private SupplierResponse loadOwned(UUID supplierId, UUID responseId) {
        return responses.findById(responseId)
                .filter(r -> r.getSupplierId().equals(supplierId))
                .orElseThrow(() -> new NotFoundException("Response", responseId));
    }

    /** {@code submission} is null for document requirements. */
    public record SubmissionOutcome(RequirementView requirement, SupplierResponse response,
                                    QuestionnaireSubmission submission) {}
}
