package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a claim against the grade table. Pure: no I/O, same answer for the same input.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LimitValidator {

    private final GradeLimitPolicy policy;

    public LimitCheckResult check(Grade grade, ExpenseCategory category, BigDecimal amount, TravelMode travelMode) {
        Optional<BigDecimal> ceiling = policy.ceiling(grade, category);
        if (ceiling.isEmpty()) {
            return LimitCheckResult.violation(String.format(
                    "No expense limit configured for grade %s and category %s", grade, category.getValue()));
        }

        BigDecimal max = ceiling.get();
        if (amount.compareTo(max) > 0) {
            return LimitCheckResult.violation(String.format(
                    "Amount %s %s exceeds grade %s limit of %s %s for %s",
                    policy.getCurrency(), amount.toPlainString(), grade,
                    policy.getCurrency(), max.toPlainString(), category.getValue()));
        }

        if (category == ExpenseCategory.TRAVEL && travelMode != null) {
            Set<TravelMode> allowed = policy.allowedTravelModes(grade);
            if (!allowed.contains(travelMode)) {
                return LimitCheckResult.violation(String.format(
                        "Travel mode '%s' not allowed for grade %s", travelMode.getValue(), grade));
            }
        }

        log.debug("Claim within limits: grade={}, category={}, amount={}", grade, category, amount);
        return LimitCheckResult.ok();
    }
}
