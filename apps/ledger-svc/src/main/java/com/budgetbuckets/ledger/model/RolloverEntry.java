package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit row of a rollover. {@code openingAmount} is the previous carryover of a spend bucket
 * or the previous balance of a save bucket; {@code movedAmount} is the spend, payment or
 * contribution of the cycle; {@code closingAmount} the resulting carryover or balance.
 */
public record RolloverEntry(
        UUID id,
        UUID userId,
        UUID bucketId,
        String bucketName,
        BucketMode mode,
        Instant rolloverDate,
        BigDecimal openingAmount,
        BigDecimal fundedAmount,
        BigDecimal movedAmount,
        BigDecimal closingAmount,
        BigDecimal newFundedAmount,
        String message
) {
}
