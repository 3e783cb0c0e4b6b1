package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class TopicEmbeddable {

    @Column(name = "topic_id", nullable = false, length = 64)
    private String topicId;

    @Column(nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    public TopicEmbeddable() {}

    public TopicEmbeddable(String topicId, String name, String description, int sortOrder) {
        this.topicId = topicId;
        this.name = name;
        this.description = description;
        this.sortOrder = sortOrder;
    }

    public String getTopicId() { return topicId; }
    public void setTopicId(String topicId) { this.topicId = topicId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public int getSortOrder() { return sortOrder; }
    public void setSortOrder(int sortOrder) { this.sortOrder = sortOrder; }
}
