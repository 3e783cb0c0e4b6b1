package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.requirement.ReportGrade;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public class DocumentReportRequest {
  @NotNull public ReportGrade grade;
  @NotNull public LocalDate reportDate;
  @Size(max=200) public String reference;
}
