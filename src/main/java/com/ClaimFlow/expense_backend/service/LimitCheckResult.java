package com.ClaimFlow.expense_backend.service;

import lombok.Value;

@Value
public class LimitCheckResult {
    boolean withinLimits;
    String reason;

    public static LimitCheckResult ok() {
        return new LimitCheckResult(true, null);
    }

    public static LimitCheckResult violation(String reason) {
        return new LimitCheckResult(false, reason);
    }
}
