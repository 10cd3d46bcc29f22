package com.budgetbuckets.ledger.rollover;

import com.budgetbuckets.ledger.model.BucketMode;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * One report line per bucket and cycle.
 */
public sealed interface BucketRolloverResult {

    UUID bucketId();

    String bucketName();

    BucketMode mode();

    record SpendResult(
            UUID bucketId,
            String bucketName,
            BigDecimal previousCarryover,
            BigDecimal thisCycleFunding,
            BigDecimal totalSpent,
            BigDecimal unspent,
            BigDecimal newFundedAmount,
            BigDecimal newTotalAvailable,
            boolean recomputed
    ) implements BucketRolloverResult {
        @Override
        public BucketMode mode() {
            return BucketMode.SPEND;
        }
    }

    record RecurringResult(
            UUID bucketId,
            String bucketName,
            BigDecimal newFundedAmount,
            BigDecimal paymentAmount,
            UUID paymentExpenseId,
            String message
    ) implements BucketRolloverResult {
        @Override
        public BucketMode mode() {
            return BucketMode.RECURRING;
        }
    }

    record SaveResult(
            UUID bucketId,
            String bucketName,
            BigDecimal previousBalance,
            BigDecimal contribution,
            BigDecimal newBalance,
            BigDecimal targetAmount,
            BigDecimal percentOfGoal,
            BigDecimal overTargetBy,
            ContributionStatus status,
            String message
    ) implements BucketRolloverResult {
        @Override
        public BucketMode mode() {
            return BucketMode.SAVE;
        }
    }

    enum ContributionStatus {
        APPLIED,
        TARGET_REACHED,
        ALREADY_CONTRIBUTED,
        NO_CONTRIBUTION
    }
}
