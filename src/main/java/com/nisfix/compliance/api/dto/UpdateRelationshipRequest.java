package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.Size;

import java.util.List;

public class UpdateRelationshipRequest {
  @Size(max=2000) public String notes;
  public List<String> servicesProvided;
  @Size(max=100) public String contractRef;
}
