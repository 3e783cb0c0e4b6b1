package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.NotBlank;

public class VerifyRequest {
  @NotBlank public String token;
}
