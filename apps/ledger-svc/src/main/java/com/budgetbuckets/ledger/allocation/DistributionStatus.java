package com.budgetbuckets.ledger.allocation;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only view of the current allocation. {@code totalFunded} is what the buckets hold
 * right now, so it lags behind income changes until the next distribution.
 */
public record DistributionStatus(
        UUID userId,
        BigDecimal totalIncome,
        BigDecimal totalPlanned,
        BigDecimal totalFunded,
        BigDecimal unallocated,
        boolean isOverPlanned,
        BigDecimal overPlannedBy
) {
}
