package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "questionnaire_templates", indexes = {
        @Index(name = "idx_templates_owner", columnList = "owner_organization_id"),
        @Index(name = "idx_templates_visibility", columnList = "is_system, visibility, category")
})
public class QuestionnaireTemplateEntity {
    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(length = 4000)
    private String description;

    @Column(nullable = false, length = 16)
    private String category;

    @Column(name = "template_version", nullable = false, length = 32)
    private String templateVersion;

    @Column(name = "is_system", nullable = false)
    private boolean system;

    @Column(name = "owner_organization_id")
    private UUID ownerOrganizationId;

    @Column(name = "created_by")
    private UUID createdBy;

    @Column(nullable = false, length = 16)
    private String visibility;

    @Column(name = "default_passing_score", nullable = false)
    private int defaultPassingScore;

    @Column(name = "estimated_minutes", nullable = false)
    private int estimatedMinutes;

    @ElementCollection
    @CollectionTable(name = "questionnaire_template_topics", joinColumns = @JoinColumn(name = "template_id"))
    @OrderColumn(name = "seq")
    private List<TopicEmbeddable> topics = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> tags = new ArrayList<>();

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getTemplateVersion() { return templateVersion; }
    public void setTemplateVersion(String templateVersion) { this.templateVersion = templateVersion; }

    public boolean isSystem() { return system; }
    public void setSystem(boolean system) { this.system = system; }

    public UUID getOwnerOrganizationId() { return ownerOrganizationId; }
    public void setOwnerOrganizationId(UUID ownerOrganizationId) { this.ownerOrganizationId = ownerOrganizationId; }

    public UUID getCreatedBy() { return createdBy; }
    public void setCreatedBy(UUID createdBy) { this.createdBy = createdBy; }

    public String getVisibility() { return visibility; }
    public void setVisibility(String visibility) { this.visibility = visibility; }

    public int getDefaultPassingScore() { return defaultPassingScore; }
    public void setDefaultPassingScore(int defaultPassingScore) { this.defaultPassingScore = defaultPassingScore; }

    public int getEstimatedMinutes() { return estimatedMinutes; }
    public void setEstimatedMinutes(int estimatedMinutes) { this.estimatedMinutes = estimatedMinutes; }

    public List<TopicEmbeddable> getTopics() { return topics; }
    public void setTopics(List<TopicEmbeddable> topics) { this.topics = topics; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public int getUsageCount() { return usageCount; }
    public void setUsageCount(int usageCount) { this.usageCount = usageCount; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }

    public OffsetDateTime getPublishedAt() { return publishedAt; }
    public void setPublishedAt(OffsetDateTime publishedAt) { this.publishedAt = publishedAt; }
}
