package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Fixed bills such as insurance or subscriptions. Funded like a spend bucket, but paid
 * automatically at rollover instead of through discretionary expenses.
 */
public record RecurringPlan(
        Allocation allocation,
        BigDecimal fundedAmount,
        BigDecimal carryoverBalance,
        RolloverBasis rolloverBasis
) implements FundedPlan {

    public RecurringPlan {
        Objects.requireNonNull(allocation, "allocation");
        fundedAmount = fundedAmount == null ? BigDecimal.ZERO : fundedAmount;
        carryoverBalance = carryoverBalance == null ? BigDecimal.ZERO : carryoverBalance;
    }

    public static RecurringPlan fresh(Allocation allocation) {
        return new RecurringPlan(allocation, BigDecimal.ZERO, BigDecimal.ZERO, null);
    }

    @Override
    public BucketMode mode() {
        return BucketMode.RECURRING;
    }

    @Override
    public RecurringPlan withFundedAmount(BigDecimal newFundedAmount) {
        return new RecurringPlan(allocation, newFundedAmount, carryoverBalance, rolloverBasis);
    }

    @Override
    public RecurringPlan withAllocation(Allocation newAllocation) {
        return new RecurringPlan(newAllocation, fundedAmount, carryoverBalance, rolloverBasis);
    }

    @Override
    public RecurringPlan withRollover(BigDecimal newCarryover, BigDecimal newFundedAmount, RolloverBasis basis) {
        return new RecurringPlan(allocation, newFundedAmount, newCarryover, basis);
    }
}
