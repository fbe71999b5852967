package com.ClaimFlow.expense_backend.service.analysis;

import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

/**
 * What the claimant told us, plus the grade rules the model should audit against.
 */
@Value
@Builder
public class ClaimContext {
    ExpenseCategory category;
    BigDecimal amount;
    String currency;
    Grade grade;
    String description;
    LocalDate expenseDate;
    TravelMode travelMode;
    BigDecimal categoryLimit;
    Set<TravelMode> allowedTravelModes;
}
