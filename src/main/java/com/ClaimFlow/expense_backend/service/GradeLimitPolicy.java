package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.config.ExpensePolicyProperties;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.TravelMode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable grade table: amount ceiling per (grade, category) and the travel modes each grade may use.
 */
public final class GradeLimitPolicy {

    private final String currency;
    private final Map<Grade, Map<ExpenseCategory, BigDecimal>> ceilings;
    private final Map<Grade, Set<TravelMode>> travelModes;

    public GradeLimitPolicy(String currency,
                            Map<Grade, Map<ExpenseCategory, BigDecimal>> ceilings,
                            Map<Grade, Set<TravelMode>> travelModes) {
        this.currency = currency;

        Map<Grade, Map<ExpenseCategory, BigDecimal>> ceilingCopy = new EnumMap<>(Grade.class);
        ceilings.forEach((grade, limits) -> {
            Map<ExpenseCategory, BigDecimal> limitCopy = new EnumMap<>(ExpenseCategory.class);
            limitCopy.putAll(limits);
            ceilingCopy.put(grade, Collections.unmodifiableMap(limitCopy));
        });
        this.ceilings = Collections.unmodifiableMap(ceilingCopy);

        Map<Grade, Set<TravelMode>> modeCopy = new EnumMap<>(Grade.class);
        travelModes.forEach((grade, modes) -> modeCopy.put(grade,
                Collections.unmodifiableSet(modes.isEmpty() ? EnumSet.noneOf(TravelMode.class) : EnumSet.copyOf(modes))));
        this.travelModes = Collections.unmodifiableMap(modeCopy);
    }

    public static GradeLimitPolicy from(ExpensePolicyProperties properties) {
        Map<Grade, Map<ExpenseCategory, BigDecimal>> ceilings = new EnumMap<>(Grade.class);
        Map<Grade, Set<TravelMode>> modes = new EnumMap<>(Grade.class);

        properties.getGrades().forEach((grade, rules) -> {
            ceilings.put(grade, rules.getLimits());
            modes.put(grade, rules.getTravelModes().isEmpty()
                    ? EnumSet.noneOf(TravelMode.class)
                    : EnumSet.copyOf(rules.getTravelModes()));
        });
        return new GradeLimitPolicy(properties.getCurrency(), ceilings, modes);
    }

    public String getCurrency() {
        return currency;
    }

    public Optional<BigDecimal> ceiling(Grade grade, ExpenseCategory category) {
        Map<ExpenseCategory, BigDecimal> limits = ceilings.get(grade);
        return limits == null ? Optional.empty() : Optional.ofNullable(limits.get(category));
    }

    public Set<TravelMode> allowedTravelModes(Grade grade) {
        return travelModes.getOrDefault(grade, Collections.emptySet());
    }

    public Map<ExpenseCategory, BigDecimal> limitsFor(Grade grade) {
        return ceilings.getOrDefault(grade, Collections.emptyMap());
    }

    public Set<Grade> configuredGrades() {
        return ceilings.keySet();
    }
}
