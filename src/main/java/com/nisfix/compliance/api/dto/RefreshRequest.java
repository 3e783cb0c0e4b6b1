package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.NotBlank;

public class RefreshRequest {
  @NotBlank public String refreshToken;
}
