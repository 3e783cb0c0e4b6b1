package com.nisfix.compliance.api.dto;

import com.nisfix.compliance.domain.relationship.SupplierClassification;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public class InviteSupplierRequest {
  @NotBlank @Email public String email;
  public SupplierClassification classification;
  @Size(max=2000) public String notes;
  public List<String> servicesProvided;
  @Size(max=100) public String contractRef;
}
