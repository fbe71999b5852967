package com.ClaimFlow.expense_backend.util;

import com.ClaimFlow.expense_backend.enums.AiRecommendation;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.exception.ValidationException;

import java.util.function.Function;

/**
 * Parses optional enum-valued request parameters. Blank means "no filter"; anything
 * unrecognised is a validation error rather than silently ignored.
 */
public class FilterParser {

    private FilterParser() {
        // Utility class, no instantiation
    }

    public static ClaimStatus status(String value) {
        return parse(value, "status", ClaimStatus::fromString);
    }

    public static ExpenseCategory category(String value) {
        return parse(value, "category", ExpenseCategory::fromString);
    }

    public static Grade grade(String value) {
        return parse(value, "grade", Grade::fromString);
    }

    public static Role role(String value) {
        return parse(value, "role", Role::fromString);
    }

    public static AiRecommendation recommendation(String value) {
        return parse(value, "aiRecommendation", AiRecommendation::fromString);
    }

    private static <T> T parse(String value, String name, Function<String, T> lookup) {
        if (value == null || value.isBlank()) {
            return null;
        }
        T parsed = lookup.apply(value);
        if (parsed == null) {
            throw new ValidationException(String.format("Invalid %s: %s", name, value));
        }
        return parsed;
    }
}
