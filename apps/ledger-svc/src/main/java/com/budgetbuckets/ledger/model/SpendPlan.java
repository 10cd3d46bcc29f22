package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.util.Objects;

public record SpendPlan(
        Allocation allocation,
        BigDecimal fundedAmount,
        BigDecimal carryoverBalance,
        RolloverBasis rolloverBasis
) implements FundedPlan {

    public SpendPlan {
        Objects.requireNonNull(allocation, "allocation");
        fundedAmount = fundedAmount == null ? BigDecimal.ZERO : fundedAmount;
        carryoverBalance = carryoverBalance == null ? BigDecimal.ZERO : carryoverBalance;
    }

    public static SpendPlan fresh(Allocation allocation) {
        return new SpendPlan(allocation, BigDecimal.ZERO, BigDecimal.ZERO, null);
    }

    @Override
    public BucketMode mode() {
        return BucketMode.SPEND;
    }

    @Override
    public SpendPlan withFundedAmount(BigDecimal newFundedAmount) {
        return new SpendPlan(allocation, newFundedAmount, carryoverBalance, rolloverBasis);
    }

    @Override
    public SpendPlan withAllocation(Allocation newAllocation) {
        return new SpendPlan(newAllocation, fundedAmount, carryoverBalance, rolloverBasis);
    }

    @Override
    public SpendPlan withRollover(BigDecimal newCarryover, BigDecimal newFundedAmount, RolloverBasis basis) {
        return new SpendPlan(allocation, newFundedAmount, newCarryover, basis);
    }

    public BigDecimal totalAvailable() {
        return fundedAmount.add(carryoverBalance);
    }
}
