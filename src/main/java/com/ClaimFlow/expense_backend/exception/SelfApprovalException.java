package com.ClaimFlow.expense_backend.exception;

import org.springframework.http.HttpStatus;

public class SelfApprovalException extends ApiException {
    public SelfApprovalException(String expenseNumber) {
        super(String.format("You cannot review your own expense claim %s", expenseNumber),
                HttpStatus.FORBIDDEN,
                "SELF_APPROVAL");
    }
}
