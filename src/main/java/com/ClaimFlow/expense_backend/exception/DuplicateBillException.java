package com.ClaimFlow.expense_backend.exception;

import org.springframework.http.HttpStatus;

public class DuplicateBillException extends ApiException {
    public DuplicateBillException(String originalExpenseNumber) {
        super(String.format("This bill has already been submitted with expense claim %s", originalExpenseNumber),
                HttpStatus.CONFLICT,
                "DUPLICATE_BILL");
    }
}
