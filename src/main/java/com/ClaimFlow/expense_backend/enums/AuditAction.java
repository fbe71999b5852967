package com.ClaimFlow.expense_backend.enums;

public enum AuditAction {
    CLAIM_SUBMITTED,
    CLAIM_DELETED,
    CLAIM_APPROVED,
    CLAIM_REJECTED,
    USER_CREATED,
    USER_UPDATED,
    USER_DELETED
}
