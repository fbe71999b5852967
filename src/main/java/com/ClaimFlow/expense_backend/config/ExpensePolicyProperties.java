package com.ClaimFlow.expense_backend.config;

import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw binding of {@code expense.policy}. Turned into an immutable
 * {@link com.ClaimFlow.expense_backend.service.GradeLimitPolicy} at startup.
 */
@ConfigurationProperties(prefix = "expense.policy")
@Data
public class ExpensePolicyProperties {

    private String currency = "INR";

    private Map<Grade, GradeRules> grades = new LinkedHashMap<>();

    @Data
    public static class GradeRules {
        private Map<ExpenseCategory, BigDecimal> limits = new LinkedHashMap<>();
        private List<TravelMode> travelModes = new ArrayList<>();
    }
}
