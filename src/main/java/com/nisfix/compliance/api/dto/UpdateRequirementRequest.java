package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.requirement.Priority;
import com.nisfix.compliance.domain.requirement.ReportGrade;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;

public class UpdateRequirementRequest {
  @Size(min=1,max=200) public String title;
  @Size(max=4000) public String description;
  public Priority priority;
  public OffsetDateTime dueDate;
  @Min(0) @Max(100) public Integer passingScore;
  public ReportGrade minimumGrade;
  @Min(1) public Integer maxReportAgeDays;
}
