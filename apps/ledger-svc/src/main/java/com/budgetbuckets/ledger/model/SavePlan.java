package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Goal-based savings. {@code targetAmount} null means an open-ended goal.
 */
public record SavePlan(
        BigDecimal targetAmount,
        BigDecimal currentBalance,
        Contribution contribution,
        CapBehavior capBehavior,
        UUID capRerouteBucketId,
        Instant lastContributionDate
) implements BucketPlan {

    public SavePlan {
        currentBalance = currentBalance == null ? BigDecimal.ZERO : currentBalance;
        contribution = contribution == null ? Contribution.none() : contribution;
        capBehavior = capBehavior == null ? CapBehavior.STOP : capBehavior;
    }

    @Override
    public BucketMode mode() {
        return BucketMode.SAVE;
    }

    public boolean hasTarget() {
        return targetAmount != null;
    }

    public SavePlan withContributionApplied(BigDecimal newBalance, Instant contributedAt) {
        return new SavePlan(targetAmount, newBalance, contribution, capBehavior, capRerouteBucketId,
                Objects.requireNonNull(contributedAt, "contributedAt"));
    }

    public SavePlan withCurrentBalance(BigDecimal newBalance) {
        return new SavePlan(targetAmount, newBalance, contribution, capBehavior, capRerouteBucketId, lastContributionDate);
    }

    public SavePlan withSettings(BigDecimal newTarget, Contribution newContribution, CapBehavior newCapBehavior, UUID newRerouteBucketId) {
        return new SavePlan(newTarget, currentBalance, newContribution, newCapBehavior, newRerouteBucketId, lastContributionDate);
    }
}
