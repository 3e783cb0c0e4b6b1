package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.application.TemplateDefinition;
import com.nisfix.compliance.domain.questionnaire.Topic;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/** Used for create and update; on update null fields are left unchanged. */
public class TemplateRequest {
  @NotBlank(groups=QuestionnaireRequest.Create.class) @Size(max=200) public String name;
  @Size(max=2000) public String description;
  public String category;
  @Size(max=32) public String version;
  @Min(0) @Max(100) public Integer defaultPassingScore;
  @Min(1) public Integer estimatedMinutes;
  public List<Topic> topics;
  public List<String> tags;

  public TemplateDefinition toDefinition() {
    return new TemplateDefinition(name, description, category, version, defaultPassingScore, estimatedMinutes,
        topics, tags);
  }
}
