package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.questionnaire.ScoringMode;
import com.nisfix.compliance.domain.questionnaire.Topic;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.validation.groups.Default;

import java.util.List;

/** Used for create and update; on update null fields are left unchanged. */
public class QuestionnaireRequest {
  @NotBlank(groups=Create.class) @Size(max=200) public String name;
  @Size(max=2000) public String description;
  @Min(0) @Max(100) public Integer passingScore;
  public ScoringMode scoringMode;
  public List<Topic> topics;

  /** Validation group for creation; also runs the default constraints. */
  public interface Create extends Default {}
}
