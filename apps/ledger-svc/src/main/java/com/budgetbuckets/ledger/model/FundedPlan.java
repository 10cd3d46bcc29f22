package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;

/**
 * Plans funded from income every cycle: spend and recurring buckets.
 */
public sealed interface FundedPlan extends BucketPlan permits SpendPlan, RecurringPlan {

    Allocation allocation();

    BigDecimal fundedAmount();

    BigDecimal carryoverBalance();

    /** Inputs of the last closed cycle; null until the first rollover. */
    RolloverBasis rolloverBasis();

    FundedPlan withFundedAmount(BigDecimal fundedAmount);

    FundedPlan withAllocation(Allocation allocation);

    FundedPlan withRollover(BigDecimal carryoverBalance, BigDecimal fundedAmount, RolloverBasis rolloverBasis);
}
