package com.budgetbuckets.ledger.allocation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.UUID;

/**
 * Planned and funded amounts of one allocation pass. Buckets absent from the maps (save
 * buckets) plan and receive zero.
 */
public record AllocationPlan(
        BigDecimal totalIncome,
        BigDecimal totalPlanned,
        BigDecimal fundingRatio,
        Map<UUID, BigDecimal> planned,
        Map<UUID, BigDecimal> funded
) {
    public AllocationPlan {
        planned = Map.copyOf(planned);
        funded = Map.copyOf(funded);
    }

    public boolean isOverPlanned() {
        return totalPlanned.compareTo(totalIncome) > 0;
    }

    public BigDecimal overPlannedBy() {
        return isOverPlanned()
                ? totalPlanned.subtract(totalIncome).setScale(2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(2);
    }

    public BigDecimal plannedFor(UUID bucketId) {
        return planned.getOrDefault(bucketId, BigDecimal.ZERO);
    }

    public BigDecimal fundedFor(UUID bucketId) {
        return funded.getOrDefault(bucketId, BigDecimal.ZERO.setScale(2));
    }

    public BigDecimal totalFunded() {
        return funded.values().stream().reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
    }
}
