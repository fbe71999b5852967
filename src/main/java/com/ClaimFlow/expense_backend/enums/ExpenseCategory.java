package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExpenseCategory {
    TRAVEL,
    FOOD,
    MEDICAL,
    ACCOMMODATION,
    COMMUNICATION,
    OTHER;

    /**
     * Lenient lookup used by JSON binding; unknown values map to {@code null}.
     */
    @JsonCreator
    public static ExpenseCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ExpenseCategory.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
