package com.budgetbuckets.ledger.allocation;

import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.FundedPlan;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class AllocationPlanner {

    private final FundingRatioCalculator fundingRatioCalculator;

    public AllocationPlanner(FundingRatioCalculator fundingRatioCalculator) {
        this.fundingRatioCalculator = fundingRatioCalculator;
    }

    /**
     * Plans every active spend and recurring bucket against the income and funds them by the
     * shared ratio. Inactive and save buckets are skipped.
     */
    public AllocationPlan plan(BigDecimal totalIncome, List<Bucket> buckets) {
        Map<UUID, BigDecimal> planned = new LinkedHashMap<>();
        for (Bucket bucket : buckets) {
            if (bucket.active() && bucket.plan() instanceof FundedPlan funded) {
                planned.put(bucket.id(), funded.allocation().plannedFor(totalIncome));
            }
        }
        BigDecimal totalPlanned = planned.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal ratio = fundingRatioCalculator.fundingRatio(totalIncome, totalPlanned);

        Map<UUID, BigDecimal> fundedAmounts = new LinkedHashMap<>();
        planned.forEach((bucketId, amount) ->
                fundedAmounts.put(bucketId, fundingRatioCalculator.funded(amount, totalIncome, totalPlanned)));

        return new AllocationPlan(totalIncome, totalPlanned, ratio, planned, fundedAmounts);
    }
}
