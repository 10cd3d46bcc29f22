package com.budgetbuckets.ledger.allocation;

import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.FundedPlan;
import com.budgetbuckets.ledger.repository.BucketRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DistributionService {

    private static final Logger log = LoggerFactory.getLogger(DistributionService.class);

    private final IncomeAggregator incomeAggregator;
    private final AllocationPlanner allocationPlanner;
    private final BucketRepository bucketRepository;

    public DistributionService(IncomeAggregator incomeAggregator,
                               AllocationPlanner allocationPlanner,
                               BucketRepository bucketRepository) {
        this.incomeAggregator = incomeAggregator;
        this.allocationPlanner = allocationPlanner;
        this.bucketRepository = bucketRepository;
    }

    /**
     * Recomputes and stores the funded amount of every active spend and recurring bucket.
     * Running it twice without a change in between writes the same amounts.
     */
    @Transactional
    public DistributionResult calculateDistribution(UUID userId) {
        List<Bucket> buckets = bucketRepository.lockActiveByUserId(userId);
        BigDecimal totalIncome = incomeAggregator.totalRecurringIncome(userId);
        AllocationPlan plan = allocationPlanner.plan(totalIncome, buckets);

        int funded = 0;
        for (Bucket bucket : buckets) {
            if (bucket.plan() instanceof FundedPlan fundedPlan) {
                BigDecimal amount = plan.fundedFor(bucket.id());
                bucketRepository.save(bucket.withPlan(fundedPlan.withFundedAmount(amount)));
                funded++;
            }
        }

        if (plan.isOverPlanned()) {
            log.info("User {} over-planned by {}; funding ratio {}", userId, plan.overPlannedBy(), plan.fundingRatio());
        }
        log.debug("Distributed {} across {} buckets for user {}", totalIncome, funded, userId);
        return new DistributionResult(
                userId,
                totalIncome,
                plan.totalPlanned(),
                plan.isOverPlanned(),
                plan.overPlannedBy(),
                plan.fundingRatio(),
                funded
        );
    }

    @Transactional(readOnly = true)
    public DistributionStatus getDistributionStatus(UUID userId) {
        BigDecimal totalIncome = incomeAggregator.totalRecurringIncome(userId);
        List<Bucket> buckets = bucketRepository.findActiveByUserId(userId);
        AllocationPlan plan = allocationPlanner.plan(totalIncome, buckets);

        BigDecimal totalFunded = buckets.stream()
                .map(Bucket::plan)
                .filter(FundedPlan.class::isInstance)
                .map(FundedPlan.class::cast)
                .map(FundedPlan::fundedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new DistributionStatus(
                userId,
                totalIncome,
                plan.totalPlanned(),
                totalFunded,
                totalIncome.subtract(totalFunded),
                plan.isOverPlanned(),
                plan.overPlannedBy()
        );
    }
}
