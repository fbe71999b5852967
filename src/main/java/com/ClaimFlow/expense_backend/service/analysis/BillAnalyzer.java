package com.ClaimFlow.expense_backend.service.analysis;

import com.ClaimFlow.expense_backend.exception.AnalysisUnavailableException;
import com.ClaimFlow.expense_backend.model.BillAnalysis;

/**
 * Port to the external bill-analysis model.
 */
public interface BillAnalyzer {

    /**
     * @throws AnalysisUnavailableException on any transport, timeout or response-shape failure
     */
    BillAnalysis analyze(BillDocument document, ClaimContext context);
}
