package com.budgetbuckets.ledger.allocation;

import java.math.BigDecimal;
import java.util.UUID;

public record DistributionResult(
        UUID userId,
        BigDecimal totalIncome,
        BigDecimal totalPlanned,
        boolean isOverPlanned,
        BigDecimal overPlannedBy,
        BigDecimal fundingRatio,
        int bucketsFunded
) {
}
