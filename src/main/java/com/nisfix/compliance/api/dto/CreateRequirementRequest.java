package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.requirement.Priority;
import com.nisfix.compliance.domain.requirement.ReportGrade;
import com.nisfix.compliance.domain.requirement.RequirementType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.UUID;

public class CreateRequirementRequest {
  @NotNull public UUID relationshipId;
  @NotNull public RequirementType type;
  @NotBlank @Size(max=200) public String title;
  @Size(max=4000) public String description;
  public Priority priority;
  public OffsetDateTime dueDate;
  public UUID questionnaireId;
  @Min(0) @Max(100) public Integer passingScore;
  public ReportGrade minimumGrade;
  @Min(1) public Integer maxReportAgeDays;
}
