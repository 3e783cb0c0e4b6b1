package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.template.TemplateVisibility;
import jakarta.validation.constraints.NotNull;

public class PublishTemplateRequest {
  @NotNull public TemplateVisibility visibility;
}
