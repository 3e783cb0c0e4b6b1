package com.nisfix.compliance.domain.template;

import com.nisfix.compliance.domain.questionnaire.Topic;
import com.nisfix.compliance.exception.CannotModifyException;
import com.nisfix.compliance.exception.InvalidTransitionException;
import com.nisfix.compliance.exception.NotEditableException;
import com.nisfix.compliance.exception.ValidationFailedException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Reusable starting point for questionnaires: a named set of topics with a default passing score.
 *
 * <p>System templates ship with the application, are always visible and never change. Company
 * templates start as drafts owned by the creating company, can be edited and deleted while unused,
 * and are published either to the owning company only or to everyone.
 */
public class QuestionnaireTemplate {

    public static final int DEFAULT_PASSING_SCORE = 70;
    public static final int DEFAULT_ESTIMATED_MINUTES = 30;
    public static final String DEFAULT_VERSION = "1.0";

    private final UUID id;
    private String name;
    private String description;
    private final TemplateCategory category;
    private String version;
    private final boolean system;
    private final UUID ownerOrganizationId;
    private final UUID createdBy;
    private TemplateVisibility visibility;
    private int defaultPassingScore;
    private int estimatedMinutes;
    private List<Topic> topics;
    private List<String> tags;
    private int usageCount;
    private final OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime publishedAt;

    public QuestionnaireTemplate(UUID id, String name, String description, TemplateCategory category,
                                 String version, boolean system, UUID ownerOrganizationId, UUID createdBy,
                                 TemplateVisibility visibility, int defaultPassingScore, int estimatedMinutes,
                                 List<Topic> topics, List<String> tags, int usageCount,
                                 OffsetDateTime createdAt, OffsetDateTime updatedAt, OffsetDateTime publishedAt) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.category = category;
        this.version = version;
        this.system = system;
        this.ownerOrganizationId = ownerOrganizationId;
        this.createdBy = createdBy;
        this.visibility = visibility;
        this.defaultPassingScore = defaultPassingScore;
        this.estimatedMinutes = estimatedMinutes;
        this.topics = topics == null ? new ArrayList<>() : new ArrayList<>(topics);
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        this.usageCount = usageCount;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.publishedAt = publishedAt;
    }

    /** New company template in DRAFT. System categories are rejected. */
    public static QuestionnaireTemplate draft(UUID organizationId, UUID userId, String name, String description,
                                              TemplateCategory category, String version, Integer passingScore,
                                              Integer estimatedMinutes, List<Topic> topics, List<String> tags,
                                              OffsetDateTime now) {
        TemplateCategory effectiveCategory = category == null ? TemplateCategory.CUSTOM : category;
        if (effectiveCategory.isSystemCategory()) {
            throw new ValidationFailedException("category " + effectiveCategory + " is reserved for system templates");
        }
        QuestionnaireTemplate template = new QuestionnaireTemplate(UUID.randomUUID(), trim(name), description,
                effectiveCategory, blankToDefault(version), false, organizationId, userId, TemplateVisibility.DRAFT,
                passingScore == null || passingScore == 0 ? DEFAULT_PASSING_SCORE : passingScore,
                estimatedMinutes == null || estimatedMinutes == 0 ? DEFAULT_ESTIMATED_MINUTES : estimatedMinutes,
                numberTopics(topics), tags, 0, now, now, null);
        template.validate();
        return template;
    }

    /** Read-only template shipped with the application, published to everyone. */
    public static QuestionnaireTemplate system(String name, String description, TemplateCategory category,
                                               String version, int passingScore, int estimatedMinutes,
                                               List<Topic> topics, List<String> tags, OffsetDateTime now) {
        QuestionnaireTemplate template = new QuestionnaireTemplate(UUID.randomUUID(), trim(name), description,
                category, blankToDefault(version), true, null, null, TemplateVisibility.GLOBAL,
                passingScore == 0 ? DEFAULT_PASSING_SCORE : passingScore,
                estimatedMinutes == 0 ? DEFAULT_ESTIMATED_MINUTES : estimatedMinutes,
                numberTopics(topics), tags, 0, now, now, now);
        template.validate();
        return template;
    }

    public void update(String name, String description, String version, Integer passingScore,
                       Integer estimatedMinutes, List<Topic> topics, List<String> tags, OffsetDateTime now) {
        requireEditable();
        if (name != null && !name.isBlank()) this.name = name.trim();
        if (description != null) this.description = description;
        if (version != null && !version.isBlank()) this.version = version.trim();
        if (passingScore != null) this.defaultPassingScore = passingScore;
        if (estimatedMinutes != null) this.estimatedMinutes = estimatedMinutes;
        if (topics != null) this.topics = numberTopics(topics);
        if (tags != null) this.tags = new ArrayList<>(tags);
        validate();
        this.updatedAt = now;
    }

    public void publish(TemplateVisibility target, OffsetDateTime now) {
        if (target != TemplateVisibility.LOCAL && target != TemplateVisibility.GLOBAL) {
            throw new ValidationFailedException("visibility must be LOCAL or GLOBAL");
        }
        if (system || visibility != TemplateVisibility.DRAFT) {
            throw new InvalidTransitionException("cannot publish this template");
        }
        if (topics.isEmpty()) {
            throw new ValidationFailedException("a template needs at least one topic to be published");
        }
        this.visibility = target;
        this.publishedAt = now;
        this.updatedAt = now;
    }

    public void unpublish(OffsetDateTime now) {
        if (system || visibility == TemplateVisibility.DRAFT) {
            throw new InvalidTransitionException("cannot unpublish this template");
        }
        if (usageCount > 0) {
            throw new CannotModifyException("template is in use by " + usageCount + " questionnaire(s)");
        }
        this.visibility = TemplateVisibility.DRAFT;
        this.publishedAt = null;
        this.updatedAt = now;
    }

    public void requireDeletable() {
        if (system) {
            throw new CannotModifyException("system templates cannot be deleted");
        }
        if (usageCount > 0) {
            throw new CannotModifyException("template is in use by " + usageCount + " questionnaire(s)");
        }
    }

    /** Only company drafts can be edited. */
    public void requireEditable() {
        if (system || visibility != TemplateVisibility.DRAFT) {
            throw new NotEditableException("cannot edit this template");
        }
    }

    public boolean isVisibleTo(UUID organizationId) {
        return system || visibility == TemplateVisibility.GLOBAL || isOwnedBy(organizationId);
    }

    /** Drafts can only be instantiated by the owning company. */
    public boolean isUsableBy(UUID organizationId) {
        return isVisibleTo(organizationId) && (visibility != TemplateVisibility.DRAFT || isOwnedBy(organizationId));
    }

    public boolean isOwnedBy(UUID organizationId) {
        return ownerOrganizationId != null && ownerOrganizationId.equals(organizationId);
    }

    private void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("name is required");
        }
        if (defaultPassingScore < 0 || defaultPassingScore > 100) {
            errors.add("defaultPassingScore must be between 0 and 100");
        }
        Set<String> topicIds = new HashSet<>();
        for (int i = 0; i < topics.size(); i++) {
            Topic topic = topics.get(i);
            if (topic.name() == null || topic.name().isBlank()) {
                errors.add("topics[" + i + "].name is required");
            }
            if (!topicIds.add(topic.id())) {
                errors.add("duplicate topic id " + topic.id());
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationFailedException(String.join("; ", errors));
        }
    }

    private static List<Topic> numberTopics(List<Topic> topics) {
        List<Topic> numbered = new ArrayList<>();
        if (topics == null) {
            return numbered;
        }
        for (Topic topic : topics) {
            String id = topic.id() == null || topic.id().isBlank() ? UUID.randomUUID().toString() : topic.id();
            int order = topic.order() == 0 ? numbered.size() + 1 : topic.order();
            numbered.add(new Topic(id, topic.name(), topic.description(), order));
        }
        return numbered;
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static String blankToDefault(String version) {
        return version == null || version.isBlank() ? DEFAULT_VERSION : version.trim();
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public TemplateCategory getCategory() { return category; }
    public String getVersion() { return version; }
    public boolean isSystem() { return system; }
    public UUID getOwnerOrganizationId() { return ownerOrganizationId; }
    public UUID getCreatedBy() { return createdBy; }
    public TemplateVisibility getVisibility() { return visibility; }
    public int getDefaultPassingScore() { return defaultPassingScore; }
    public int getEstimatedMinutes() { return estimatedMinutes; }
    public List<Topic> getTopics() { return Collections.unmodifiableList(topics); }
    public List<String> getTags() { return Collections.unmodifiableList(tags); }
    public int getUsageCount() { return usageCount; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public OffsetDateTime getPublishedAt() { return publishedAt; }
}
