package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.Size;

public class ReasonRequest {
  @Size(max=1000) public String reason;
}
