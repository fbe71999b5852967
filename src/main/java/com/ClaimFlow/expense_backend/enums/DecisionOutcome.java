package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionOutcome {
    APPROVE,
    REJECT;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
