package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public class FromTemplateRequest {
  @NotNull public UUID templateId;
  @Size(max=200) public String name;
}
