package com.ClaimFlow.expense_backend.dto.request;

import com.ClaimFlow.expense_backend.enums.AiRecommendation;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Parsed reviewer search filters. Every field is optional; null means "no filter".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimSearchCriteria {
    private String q;
    private ExpenseCategory category;
    private ClaimStatus status;
    private UUID employeeId;
    private Grade grade;
    private String department;
    private BigDecimal minAmount;
    private BigDecimal maxAmount;
    private LocalDate fromDate;
    private LocalDate toDate;
    private AiRecommendation aiRecommendation;
    private Boolean withinLimits;
}
