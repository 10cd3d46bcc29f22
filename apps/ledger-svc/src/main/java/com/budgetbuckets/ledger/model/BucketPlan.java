package com.budgetbuckets.ledger.model;

/**
 * Mode-specific state of a bucket. Only the payload of the bucket's own mode exists, so a
 * save bucket has no funded amount and a spend bucket has no savings balance.
 */
public sealed interface BucketPlan permits FundedPlan, SavePlan {

    BucketMode mode();
}
