package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum Role {
    EMPLOYEE(EnumSet.of(Permission.CLAIM_EXPENSE)),
    MANAGER(EnumSet.of(Permission.CLAIM_EXPENSE, Permission.APPROVE_EXPENSE,
            Permission.VIEW_ALL_EXPENSES, Permission.VIEW_REPORTS)),
    HR(EnumSet.of(Permission.CLAIM_EXPENSE, Permission.APPROVE_EXPENSE,
            Permission.VIEW_ALL_EXPENSES, Permission.VIEW_REPORTS)),
    FINANCE(EnumSet.of(Permission.CLAIM_EXPENSE, Permission.APPROVE_EXPENSE,
            Permission.VIEW_ALL_EXPENSES, Permission.VIEW_REPORTS)),
    ADMIN(EnumSet.of(Permission.CLAIM_EXPENSE, Permission.VIEW_ALL_EXPENSES,
            Permission.VIEW_REPORTS, Permission.MANAGE_USERS, Permission.VIEW_AUDIT_LOGS));

    private final Set<Permission> permissions;

    Role(Set<Permission> permissions) {
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public boolean hasPermission(Permission permission) {
        return permissions.contains(permission);
    }

    @JsonCreator
    public static Role fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Role.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
