package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.relationship.SupplierClassification;
import jakarta.validation.constraints.NotNull;

public class ClassificationRequest {
  @NotNull public SupplierClassification classification;
}
