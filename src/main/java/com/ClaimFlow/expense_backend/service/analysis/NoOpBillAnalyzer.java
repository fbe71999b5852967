package com.ClaimFlow.expense_backend.service.analysis;

import com.ClaimFlow.expense_backend.exception.AnalysisUnavailableException;
import com.ClaimFlow.expense_backend.model.BillAnalysis;

/**
 * Stands in when no model credentials are configured; every claim goes to manual review.
 */
public class NoOpBillAnalyzer implements BillAnalyzer {

    @Override
    public BillAnalysis analyze(BillDocument document, ClaimContext context) {
        throw new AnalysisUnavailableException("Bill analysis is not configured");
    }
}
