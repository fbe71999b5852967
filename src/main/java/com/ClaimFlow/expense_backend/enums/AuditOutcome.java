package com.ClaimFlow.expense_backend.enums;

public enum AuditOutcome {
    SUCCESS,
    DENIED
}
