package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Planned monthly allocation of a spend or recurring bucket: either a fixed amount or a
 * percentage of total recurring income.
 */
public record Allocation(AllocationType type, BigDecimal value) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final int PLANNING_SCALE = 4;

    public Allocation {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    public static Allocation amount(BigDecimal amount) {
        return new Allocation(AllocationType.AMOUNT, amount);
    }

    public static Allocation percentage(BigDecimal percent) {
        return new Allocation(AllocationType.PERCENTAGE, percent);
    }

    public BigDecimal plannedFor(BigDecimal totalIncome) {
        return switch (type) {
            case AMOUNT -> value;
            case PERCENTAGE -> totalIncome.multiply(value).divide(HUNDRED, PLANNING_SCALE, RoundingMode.HALF_UP);
        };
    }
}
