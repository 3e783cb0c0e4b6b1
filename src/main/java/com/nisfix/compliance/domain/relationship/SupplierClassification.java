package com.nisfix.compliance.domain.relationship;

/**
 * How critical a supplier is to the company's operations.
 */
public enum SupplierClassification {
    CRITICAL(3),
    IMPORTANT(2),
    STANDARD(1);

    private final int priority;

    SupplierClassification(int priority) {
        this.priority = priority;
    }

    /** Higher means more critical. */
    public int getPriority() {
        return priority;
    }
}
