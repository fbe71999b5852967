package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AiRecommendation {
    APPROVE,
    REJECT,
    REVIEW;

    @JsonCreator
    public static AiRecommendation fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return AiRecommendation.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name();
    }
}
