package com.nisfix.compliance.api;

import com.nisfix.compliance.application.RequirementView;
import com.nisfix.compliance.config.JwtService.TokenPair;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationSettings;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.StatusChange;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.questionnaire.Question;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.response.DraftAnswer;
import com.nisfix.compliance.domain.response.QuestionnaireSubmission;
import com.nisfix.compliance.domain.response.SubmissionAnswer;
import com.nisfix.compliance.domain.response.SupplierResponse;
import com.nisfix.compliance.domain.response.TopicScore;
import com.nisfix.compliance.domain.template.QuestionnaireTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * JSON shapes returned by the controllers. Enum values are written by name and absent values as
 * null, so clients always see the same keys.
 */
final class ApiViews {

    private ApiViews() {}

    static <T> Map<String, Object> page(PageResult<T> page, Function<T, Map<String, Object>> mapper) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("items", page.items().stream().map(mapper).toList());
        m.put("totalCount", page.totalCount());
        m.put("page", page.page());
        m.put("limit", page.limit());
        m.put("totalPages", page.totalPages());
        return m;
    }

    static Map<String, Object> tokens(TokenPair tokens, User user, Organization org) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("accessToken", tokens.accessToken());
        m.put("refreshToken", tokens.refreshToken());
        m.put("tokenType", tokens.tokenType());
        m.put("expiresIn", tokens.expiresIn());
        m.put("user", user(user));
        m.put("organization", organization(org));
        return m;
    }

    static Map<String, Object> user(User u) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", u.getId());
        m.put("email", u.getEmail());
        m.put("name", u.getName());
        m.put("role", u.getRole().name());
        m.put("organizationId", u.getOrganizationId());
        m.put("active", u.isActive());
        m.put("lastLoginAt", u.getLastLoginAt());
        m.put("createdAt", u.getCreatedAt());
        return m;
    }

    static Map<String, Object> organization(Organization o) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", o.getId());
        m.put("type", o.getType().name());
        m.put("name", o.getName());
        m.put("slug", o.getSlug());
        m.put("domain", o.getDomain());
        m.put("contactEmail", o.getContactEmail());
        m.put("contactPhone", o.getContactPhone());
        m.put("address", o.getAddress());
        m.put("settings", settings(o.getSettings()));
        m.put("createdAt", o.getCreatedAt());
        m.put("updatedAt", o.getUpdatedAt());
        return m;
    }

    static Map<String, Object> settings(OrganizationSettings s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("defaultDueDays", s.defaultDueDays());
        m.put("reminderDaysBefore", s.reminderDaysBefore());
        m.put("requireApproval", s.requireApproval());
        m.put("notificationsEnabled", s.notificationsEnabled());
        return m;
    }

    static Map<String, Object> relationship(Relationship r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.getId());
        m.put("companyId", r.getCompanyId());
        m.put("supplierId", r.getSupplierId());
        m.put("invitedEmail", r.getInvitedEmail());
        m.put("invitedByUserId", r.getInvitedByUserId());
        m.put("status", r.getStatus().name());
        m.put("classification", r.getClassification().name());
        m.put("notes", r.getNotes());
        m.put("servicesProvided", r.getServicesProvided());
        m.put("contractRef", r.getContractRef());
        m.put("invitedAt", r.getInvitedAt());
        m.put("acceptedAt", r.getAcceptedAt());
        m.put("declinedAt", r.getDeclinedAt());
        m.put("terminatedAt", r.getTerminatedAt());
        m.put("statusHistory", history(r.getStatusHistory()));
        m.put("createdAt", r.getCreatedAt());
        m.put("updatedAt", r.getUpdatedAt());
        m.put("version", r.getVersion());
        return m;
    }

    static Map<String, Object> requirement(RequirementView view) {
        Requirement r = view.requirement();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.getId());
        m.put("relationshipId", r.getRelationshipId());
        m.put("companyId", r.getCompanyId());
        m.put("supplierId", r.getSupplierId());
        m.put("type", r.getType().name());
        m.put("title", r.getTitle());
        m.put("description", r.getDescription());
        m.put("priority", r.getPriority().name());
        m.put("status", r.getStatus().name());
        m.put("questionnaireId", r.getQuestionnaireId());
        m.put("passingScore", r.getPassingScore());
        m.put("minimumGrade", r.getMinimumGrade() == null ? null : r.getMinimumGrade().name());
        m.put("maxReportAgeDays", r.getMaxReportAgeDays());
        m.put("dueDate", r.getDueDate());
        m.put("overdue", view.overdue());
        m.put("daysUntilDue", view.daysUntilDue());
        m.put("reminderSentAt", r.getReminderSentAt());
        m.put("assignedByUserId", r.getAssignedByUserId());
        m.put("assignedAt", r.getAssignedAt());
        m.put("statusHistory", history(r.getStatusHistory()));
        m.put("createdAt", r.getCreatedAt());
        m.put("updatedAt", r.getUpdatedAt());
        m.put("version", r.getVersion());
        return m;
    }

    static <S extends Enum<S>> List<Map<String, Object>> history(List<StatusChange<S>> changes) {
        return changes.stream().map(c -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("fromStatus", c.getFromStatus() == null ? null : c.getFromStatus().name());
            m.put("toStatus", c.getToStatus().name());
            m.put("changedBy", c.getChangedBy());
            m.put("reason", c.getReason());
            m.put("changedAt", c.getChangedAt());
            return m;
        }).toList();
    }

    static Map<String, Object> questionnaire(Questionnaire q) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", q.getId());
        m.put("companyId", q.getCompanyId());
        m.put("templateId", q.getTemplateId());
        m.put("name", q.getName());
        m.put("description", q.getDescription());
        m.put("status", q.getStatus().name());
        m.put("passingScore", q.getPassingScore());
        m.put("scoringMode", q.getScoringMode().name());
        m.put("topics", q.getTopics());
        m.put("questionCount", q.getQuestionCount());
        m.put("maxPossibleScore", q.getMaxPossibleScore());
        m.put("createdAt", q.getCreatedAt());
        m.put("updatedAt", q.getUpdatedAt());
        m.put("publishedAt", q.getPublishedAt());
        return m;
    }

    static Map<String, Object> template(QuestionnaireTemplate t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", t.getId());
        m.put("name", t.getName());
        m.put("description", t.getDescription());
        m.put("category", t.getCategory().name());
        m.put("version", t.getVersion());
        m.put("isSystem", t.isSystem());
        m.put("ownerOrganizationId", t.getOwnerOrganizationId());
        m.put("visibility", t.getVisibility().name());
        m.put("defaultPassingScore", t.getDefaultPassingScore());
        m.put("estimatedMinutes", t.getEstimatedMinutes());
        m.put("topics", t.getTopics());
        m.put("topicCount", t.getTopics().size());
        m.put("tags", t.getTags());
        m.put("usageCount", t.getUsageCount());
        m.put("createdAt", t.getCreatedAt());
        m.put("updatedAt", t.getUpdatedAt());
        m.put("publishedAt", t.getPublishedAt());
        return m;
    }

    static Map<String, Object> question(Question q) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", q.getId());
        m.put("questionnaireId", q.getQuestionnaireId());
        m.put("topicId", q.getTopicId());
        m.put("text", q.getText());
        m.put("description", q.getDescription());
        m.put("helpText", q.getHelpText());
        m.put("type", q.getType().name());
        m.put("order", q.getOrder());
        m.put("weight", q.getWeight());
        m.put("maxPoints", q.getMaxPoints());
        m.put("mustPass", q.isMustPass());
        m.put("options", q.getOptions());
        return m;
    }

    static Map<String, Object> response(SupplierResponse r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.getId());
        m.put("requirementId", r.getRequirementId());
        m.put("supplierId", r.getSupplierId());
        m.put("submissionId", r.getSubmissionId());
        m.put("documentReport", r.getDocumentReport());
        m.put("score", r.getScore());
        m.put("maxScore", r.getMaxScore());
        m.put("passed", r.getPassed());
        m.put("grade", r.getGrade() == null ? null : r.getGrade().name());
        m.put("draftAnswers", r.getDraftAnswers().stream().map(ApiViews::draft).toList());
        m.put("reviewedByUserId", r.getReviewedByUserId());
        m.put("reviewedAt", r.getReviewedAt());
        m.put("reviewNotes", r.getReviewNotes());
        m.put("overrideScore", r.getOverrideScore());
        m.put("overrideGrade", r.getOverrideGrade() == null ? null : r.getOverrideGrade().name());
        m.put("startedAt", r.getStartedAt());
        m.put("submittedAt", r.getSubmittedAt());
        return m;
    }

    private static Map<String, Object> draft(DraftAnswer a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("questionId", a.questionId());
        m.put("selectedOptions", a.selectedOptions());
        m.put("textAnswer", a.textAnswer());
        m.put("savedAt", a.savedAt());
        return m;
    }

    static Map<String, Object> submission(QuestionnaireSubmission s) {
        if (s == null) {
            return null;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", s.getId());
        m.put("responseId", s.getResponseId());
        m.put("requirementId", s.getRequirementId());
        m.put("questionnaireId", s.getQuestionnaireId());
        m.put("supplierId", s.getSupplierId());
        m.put("answers", s.getAnswers().stream().map(ApiViews::answer).toList());
        m.put("totalScore", s.getTotalScore());
        m.put("maxPossibleScore", s.getMaxPossibleScore());
        m.put("percentageScore", s.getPercentageScore());
        m.put("passingScore", s.getPassingScore());
        m.put("passed", s.isPassed());
        m.put("mustPassFailed", s.isMustPassFailed());
        m.put("topicScores", s.getTopicScores().stream().map(ApiViews::topicScore).toList());
        m.put("completionTimeMinutes", s.getCompletionTimeMinutes());
        m.put("startedAt", s.getStartedAt());
        m.put("submittedAt", s.getSubmittedAt());
        return m;
    }

    private static Map<String, Object> answer(SubmissionAnswer a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("questionId", a.questionId());
        m.put("selectedOptions", a.selectedOptions());
        m.put("textAnswer", a.textAnswer());
        m.put("pointsEarned", a.pointsEarned());
        m.put("maxPoints", a.maxPoints());
        m.put("mustPassMet", a.mustPassMet());
        return m;
    }

    private static Map<String, Object> topicScore(TopicScore t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("topicId", t.topicId());
        m.put("topicName", t.topicName());
        m.put("score", t.score());
        m.put("maxScore", t.maxScore());
        m.put("percentageScore", t.percentageScore());
        return m;
    }
}
