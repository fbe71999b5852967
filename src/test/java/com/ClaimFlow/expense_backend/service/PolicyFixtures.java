package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.TravelMode;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The default A-D policy table, built in code for unit tests.
 */
public final class PolicyFixtures {

    private PolicyFixtures() {
    }

    public static GradeLimitPolicy defaultPolicy() {
        Map<Grade, Map<ExpenseCategory, BigDecimal>> ceilings = new EnumMap<>(Grade.class);
        ceilings.put(Grade.A, limits(1500, 500, 2000, 1000, 300, 500));
        ceilings.put(Grade.B, limits(2000, 700, 3000, 1500, 500, 700));
        ceilings.put(Grade.C, limits(3000, 1000, 5000, 2000, 700, 1000));
        ceilings.put(Grade.D, limits(5000, 1500, 7000, 3000, 1000, 1500));

        Map<Grade, Set<TravelMode>> modes = new EnumMap<>(Grade.class);
        modes.put(Grade.A, EnumSet.of(TravelMode.BUS, TravelMode.TRAIN));
        modes.put(Grade.B, EnumSet.of(TravelMode.BUS, TravelMode.TRAIN));
        modes.put(Grade.C, EnumSet.of(TravelMode.BUS, TravelMode.TRAIN, TravelMode.FLIGHT_ECONOMY));
        modes.put(Grade.D, EnumSet.allOf(TravelMode.class));

        return new GradeLimitPolicy("INR", ceilings, modes);
    }

    private static Map<ExpenseCategory, BigDecimal> limits(int travel, int food, int accommodation,
                                                           int medical, int communication, int other) {
        Map<ExpenseCategory, BigDecimal> limits = new EnumMap<>(ExpenseCategory.class);
        limits.put(ExpenseCategory.TRAVEL, BigDecimal.valueOf(travel));
        limits.put(ExpenseCategory.FOOD, BigDecimal.valueOf(food));
        limits.put(ExpenseCategory.ACCOMMODATION, BigDecimal.valueOf(accommodation));
        limits.put(ExpenseCategory.MEDICAL, BigDecimal.valueOf(medical));
        limits.put(ExpenseCategory.COMMUNICATION, BigDecimal.valueOf(communication));
        limits.put(ExpenseCategory.OTHER, BigDecimal.valueOf(other));
        return limits;
    }
}
