package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.response.BillAnalysisResponse;
import com.ClaimFlow.expense_backend.dto.response.DecisionResponse;
import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.enums.Permission;
import com.ClaimFlow.expense_backend.model.ApprovalDecision;
import com.ClaimFlow.expense_backend.model.BillAnalysis;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class ExpenseClaimMapper {

    /**
     * Reviewers looking at someone else's claim see the full analysis; everyone else,
     * owners included, gets the reduced view.
     */
    public ExpenseClaimResponse toResponse(ExpenseClaim claim, List<ApprovalDecision> decisions, User viewer) {
        boolean reviewerView = !claim.isOwnedBy(viewer.getId())
                && viewer.hasPermission(Permission.VIEW_ALL_EXPENSES);

        return ExpenseClaimResponse.builder()
                .id(claim.getId())
                .expenseNumber(claim.getExpenseNumber())
                .ownerId(claim.getOwner() != null ? claim.getOwner().getId() : null)
                .ownerName(claim.getOwnerName())
                .category(claim.getCategory())
                .amount(claim.getAmount())
                .currency(claim.getCurrency())
                .expenseDate(claim.getExpenseDate())
                .description(claim.getDescription())
                .travelMode(claim.getTravelMode())
                .travelFrom(claim.getTravelFrom())
                .travelTo(claim.getTravelTo())
                .billFileName(claim.getBillFileName())
                .status(claim.getStatus())
                .withinLimits(claim.isWithinLimits())
                .limitReason(claim.getLimitReason())
                .analysisPresent(claim.isAnalysisPresent())
                .analysis(claim.isAnalysisPresent() ? toAnalysisResponse(claim.getBillAnalysis(), reviewerView) : null)
                .decisions(decisions.stream().map(this::toDecisionResponse).collect(Collectors.toList()))
                .rejectionReason(claim.getRejectionReason())
                .submittedAt(claim.getSubmittedAt())
                .approvedAt(claim.getApprovedAt())
                .rejectedAt(claim.getRejectedAt())
                .updatedAt(claim.getUpdatedAt())
                .build();
    }

    public ExpenseClaimResponse toResponse(ExpenseClaim claim, User viewer) {
        return toResponse(claim, Collections.emptyList(), viewer);
    }

    BillAnalysisResponse toAnalysisResponse(BillAnalysis analysis, boolean reviewerView) {
        if (analysis == null) {
            return null;
        }
        BillAnalysisResponse.BillAnalysisResponseBuilder builder = BillAnalysisResponse.builder()
                .confidenceScore(analysis.getConfidenceScore())
                .billNumber(analysis.getBillNumber())
                .billDate(analysis.getBillDate())
                .vendorName(analysis.getVendorName())
                .extractedAmount(analysis.getExtractedAmount())
                .hasGst(analysis.getHasGst())
                .travelMode(analysis.getTravelMode())
                .travelRoute(analysis.getTravelRoute())
                .summary(analysis.getSummary());

        if (reviewerView) {
            builder.authentic(analysis.getAuthentic())
                    .recommendation(analysis.getRecommendation())
                    .recommendationReason(analysis.getRecommendationReason())
                    .flaggedIssues(analysis.getFlaggedIssues() == null
                            ? Collections.emptyList() : new ArrayList<>(analysis.getFlaggedIssues()));
        }
        return builder.build();
    }

    public DecisionResponse toDecisionResponse(ApprovalDecision decision) {
        return DecisionResponse.builder()
                .id(decision.getId())
                .actorName(decision.getActorName())
                .actorRole(decision.getActorRole())
                .outcome(decision.getOutcome())
                .comments(decision.getComments())
                .fromStatus(decision.getFromStatus())
                .toStatus(decision.getToStatus())
                .decidedAt(decision.getDecidedAt())
                .build();
    }
}
