package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** {@code organizationName} is only needed when the invited email has no account yet. */
public class RedeemInvitationRequest {
  @NotBlank public String token;
  @Size(max=200) public String organizationName;
  @Size(max=200) public String name;
}
