package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClaimStatus {
    SUBMITTED,
    MANAGER_REVIEW,
    HR_REVIEW,
    FINANCE_REVIEW,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }

    @JsonCreator
    public static ClaimStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ClaimStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
