package com.ClaimFlow.expense_backend.exception;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InvalidStateException extends ApiException {

    private final ClaimStatus currentStatus;

    public InvalidStateException(String message, ClaimStatus currentStatus) {
        super(message, HttpStatus.CONFLICT, "INVALID_STATE");
        this.currentStatus = currentStatus;
    }
}
