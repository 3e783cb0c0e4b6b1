package com.nisfix.compliance.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public class UpdateOrganizationRequest {
  @Size(min=1,max=200) public String name;
  @Size(max=253) public String domain;
  @Email public String contactEmail;
  @Size(max=50) public String contactPhone;
  @Size(max=500) public String address;
}
