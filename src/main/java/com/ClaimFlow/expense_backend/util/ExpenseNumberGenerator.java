package com.ClaimFlow.expense_backend.util;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Human-readable claim ids of the form {@code EXP-20250114-1A2B3C}.
 */
@Component
public class ExpenseNumberGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public ExpenseNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6).toUpperCase();
        return "EXP-" + LocalDate.now(clock).format(DAY) + "-" + suffix;
    }
}
