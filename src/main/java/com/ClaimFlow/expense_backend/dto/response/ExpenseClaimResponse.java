package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExpenseClaimResponse {
    private UUID id;
    private String expenseNumber;
    private UUID ownerId;
    private String ownerName;
    private ExpenseCategory category;
    private BigDecimal amount;
    private String currency;
    private LocalDate expenseDate;
    private String description;
    private TravelMode travelMode;
    private String travelFrom;
    private String travelTo;
    private String billFileName;
    private ClaimStatus status;
    private boolean withinLimits;
    private String limitReason;
    private boolean analysisPresent;
    private BillAnalysisResponse analysis;
    private List<DecisionResponse> decisions;
    private String rejectionReason;
    private LocalDateTime submittedAt;
    private LocalDateTime approvedAt;
    private LocalDateTime rejectedAt;
    private LocalDateTime updatedAt;
}
