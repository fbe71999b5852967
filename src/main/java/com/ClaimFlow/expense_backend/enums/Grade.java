package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Grade {
    A,
    B,
    C,
    D;

    @JsonCreator
    public static Grade fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Grade.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name();
    }
}
