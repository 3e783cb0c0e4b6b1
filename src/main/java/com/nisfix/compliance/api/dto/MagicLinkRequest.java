package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public class MagicLinkRequest {
  @NotBlank @Email public String email;
}
