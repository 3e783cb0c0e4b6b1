package com.nisfix.compliance.domain.requirement;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
