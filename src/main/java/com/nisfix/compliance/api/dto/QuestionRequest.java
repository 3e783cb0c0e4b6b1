package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.questionnaire.QuestionOption;
import com.nisfix.compliance.domain.questionnaire.QuestionType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/** Used for create and update; on update null fields are left unchanged. */
public class QuestionRequest {
  public String topicId;
  @NotBlank(groups=QuestionnaireRequest.Create.class) @Size(max=2000) public String text;
  @Size(max=2000) public String description;
  @Size(max=2000) public String helpText;
  @NotNull(groups=QuestionnaireRequest.Create.class) public QuestionType type;
  @Min(1) public Integer order;
  @Min(1) public Integer weight;
  public Boolean mustPass;
  public List<QuestionOption> options;
}
