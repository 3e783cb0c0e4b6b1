package com.nisfix.compliance.domain;

public enum OrganizationType {
    COMPANY,
    SUPPLIER
}
