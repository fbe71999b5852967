package com.ClaimFlow.expense_backend.enums;

public enum Permission {
    CLAIM_EXPENSE,
    APPROVE_EXPENSE,
    VIEW_ALL_EXPENSES,
    VIEW_REPORTS,
    MANAGE_USERS,
    VIEW_AUDIT_LOGS
}
