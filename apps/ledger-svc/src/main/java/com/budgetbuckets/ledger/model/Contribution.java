package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Monthly contribution rule of a save bucket. {@code value} is null for {@link ContributionType#NONE}.
 */
public record Contribution(ContributionType type, BigDecimal value) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Contribution {
        Objects.requireNonNull(type, "type");
        if (type != ContributionType.NONE) {
            Objects.requireNonNull(value, "value");
        }
    }

    public static Contribution none() {
        return new Contribution(ContributionType.NONE, null);
    }

    public static Contribution amount(BigDecimal amount) {
        return new Contribution(ContributionType.AMOUNT, amount);
    }

    public static Contribution percentage(BigDecimal percent) {
        return new Contribution(ContributionType.PERCENTAGE, percent);
    }

    public boolean contributes() {
        return type != ContributionType.NONE;
    }

    public BigDecimal monthlyAmount(BigDecimal totalIncome) {
        return switch (type) {
            case NONE -> BigDecimal.ZERO;
            case AMOUNT -> value;
            case PERCENTAGE -> totalIncome.multiply(value).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        };
    }
}
