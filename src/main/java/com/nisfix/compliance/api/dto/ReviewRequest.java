package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.requirement.ReportGrade;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

public class ReviewRequest {
  @Size(max=2000) public String notes;
  @Size(max=2000) public String reason;
  @Min(0) public Integer overrideScore;
  public ReportGrade overrideGrade;
}
