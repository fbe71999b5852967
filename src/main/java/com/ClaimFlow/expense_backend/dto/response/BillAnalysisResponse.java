package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.AiRecommendation;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Reviewers receive every field. Claim owners get the reduced view, where the
 * authenticity verdict, recommendation and flags are left null and so omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BillAnalysisResponse {
    private Boolean authentic;
    private Integer confidenceScore;
    private String billNumber;
    private LocalDate billDate;
    private String vendorName;
    private BigDecimal extractedAmount;
    private Boolean hasGst;
    private String travelMode;
    private String travelRoute;
    private AiRecommendation recommendation;
    private String recommendationReason;
    private String summary;
    private List<String> flaggedIssues;
}
