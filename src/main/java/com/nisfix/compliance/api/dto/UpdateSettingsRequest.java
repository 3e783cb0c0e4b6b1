package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public class UpdateSettingsRequest {
  @Min(1) @Max(365) public Integer defaultDueDays;
  @Min(0) @Max(90) public Integer reminderDaysBefore;
  public Boolean requireApproval;
  public Boolean notificationsEnabled;
}
