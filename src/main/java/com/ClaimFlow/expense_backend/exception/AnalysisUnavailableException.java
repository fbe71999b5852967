package com.ClaimFlow.expense_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised by a bill analyzer when the model could not produce a usable analysis.
 * Claim intake catches it and continues without an analysis snapshot.
 */
public class AnalysisUnavailableException extends ApiException {

    public AnalysisUnavailableException(String message) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, "ANALYSIS_UNAVAILABLE");
    }

    public AnalysisUnavailableException(String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, "ANALYSIS_UNAVAILABLE", cause);
    }
}
