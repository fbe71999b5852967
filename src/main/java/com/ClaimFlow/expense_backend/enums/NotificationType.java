package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    EXPENSE_SUBMITTED,
    EXPENSE_APPROVED,
    EXPENSE_REJECTED,
    APPROVAL_REQUIRED,
    SYSTEM;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
