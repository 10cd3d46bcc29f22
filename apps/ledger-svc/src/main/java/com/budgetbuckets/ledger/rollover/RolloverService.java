package com.budgetbuckets.ledger.rollover;

import com.budgetbuckets.ledger.allocation.AllocationPlan;
import com.budgetbuckets.ledger.allocation.AllocationPlanner;
import com.budgetbuckets.ledger.allocation.IncomeAggregator;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.RecurringPlan;
import com.budgetbuckets.ledger.model.RolloverEntry;
import com.budgetbuckets.ledger.model.SavePlan;
import com.budgetbuckets.ledger.model.SpendPlan;
import com.budgetbuckets.ledger.repository.BucketRepository;
import com.budgetbuckets.ledger.repository.RolloverHistoryRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Month-end processing of a user's buckets. Each call runs in one transaction, so a failed
 * bucket leaves every bucket of the user untouched. The user's active buckets are loaded
 * with a write lock: a manual rollover racing the scheduled one waits for it and then sees
 * its results, which makes the second run a recompute.
 */
@Service
public class RolloverService {

    private static final Logger log = LoggerFactory.getLogger(RolloverService.class);

    private final BucketRepository bucketRepository;
    private final RolloverHistoryRepository rolloverHistoryRepository;
    private final IncomeAggregator incomeAggregator;
    private final AllocationPlanner allocationPlanner;
    private final CarryoverTransition carryoverTransition;
    private final RecurringPaymentHandler recurringPaymentHandler;
    private final SavingsContributionEngine savingsContributionEngine;
    private final Clock clock;

    public RolloverService(
            BucketRepository bucketRepository,
            RolloverHistoryRepository rolloverHistoryRepository,
            IncomeAggregator incomeAggregator,
            AllocationPlanner allocationPlanner,
            CarryoverTransition carryoverTransition,
            RecurringPaymentHandler recurringPaymentHandler,
            SavingsContributionEngine savingsContributionEngine,
            Clock clock
    ) {
        this.bucketRepository = bucketRepository;
        this.rolloverHistoryRepository = rolloverHistoryRepository;
        this.incomeAggregator = incomeAggregator;
        this.allocationPlanner = allocationPlanner;
        this.carryoverTransition = carryoverTransition;
        this.recurringPaymentHandler = recurringPaymentHandler;
        this.savingsContributionEngine = savingsContributionEngine;
        this.clock = clock;
    }

    @Transactional
    public RolloverReport performMonthlyRollover(UUID userId) {
        Instant now = clock.instant();
        ZoneId zone = clock.getZone();

        List<Bucket> buckets = bucketRepository.lockActiveByUserId(userId);
        BigDecimal totalIncome = incomeAggregator.totalRecurringIncome(userId);
        AllocationPlan plan = allocationPlanner.plan(totalIncome, buckets);

        List<BucketRolloverResult> results = new ArrayList<>(buckets.size());
        for (Bucket bucket : buckets) {
            BucketTransition transition = transition(bucket, plan, totalIncome, now, zone);
            bucketRepository.save(transition.bucket());
            results.add(transition.result());
        }

        rolloverHistoryRepository.saveAll(results.stream()
                .map(result -> toEntry(userId, now, result))
                .toList());

        log.info("Rollover for user {} processed {} buckets (income {}, funding ratio {})",
                userId, results.size(), totalIncome, plan.fundingRatio());
        return new RolloverReport(userId, now, results.size(), List.copyOf(results));
    }

    @Transactional
    public RolloverReport manualRollover(UUID userId) {
        log.info("Manual rollover requested for user {}", userId);
        return performMonthlyRollover(userId);
    }

    /**
     * Rolls over only on the first day of the month and only once per month. A month that
     * was already processed is reported as such, not as a failure.
     */
    @Transactional
    public RolloverCheckResult checkAndPerformRollover(UUID userId) {
        Instant now = clock.instant();
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.ofInstant(now, zone);

        if (today.getDayOfMonth() != 1) {
            return RolloverCheckResult.skipped(RolloverCheckResult.Status.NOT_DUE,
                    "Rollover only runs on the first day of the month", now, null);
        }

        List<Bucket> buckets = bucketRepository.lockActiveByUserId(userId);
        if (buckets.isEmpty()) {
            log.debug("User {} has no active buckets to roll over", userId);
            return RolloverCheckResult.skipped(RolloverCheckResult.Status.NO_BUCKETS,
                    "No buckets to roll over", now, null);
        }

        Instant lastRollover = buckets.stream()
                .map(Bucket::lastRolloverDate)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        if (lastRollover != null && YearMonth.from(lastRollover.atZone(zone)).equals(YearMonth.from(today))) {
            log.debug("Rollover for user {} already processed at {}", userId, lastRollover);
            return RolloverCheckResult.skipped(RolloverCheckResult.Status.ALREADY_PROCESSED,
                    "Rollover already processed this month", now, lastRollover);
        }

        return RolloverCheckResult.performed(now, performMonthlyRollover(userId));
    }

    @Transactional(readOnly = true)
    public List<RolloverEntry> getHistory(UUID userId) {
        return rolloverHistoryRepository.findByUserId(userId);
    }

    private BucketTransition transition(Bucket bucket, AllocationPlan plan, BigDecimal totalIncome, Instant now, ZoneId zone) {
        if (bucket.plan() instanceof SpendPlan spend) {
            return carryoverTransition.apply(bucket, spend, plan.fundedFor(bucket.id()), now, zone);
        }
        if (bucket.plan() instanceof RecurringPlan recurring) {
            return recurringPaymentHandler.apply(bucket, recurring, plan.fundedFor(bucket.id()), now, zone);
        }
        if (bucket.plan() instanceof SavePlan save) {
            return savingsContributionEngine.apply(bucket, save, totalIncome, now, zone);
        }
        throw new IllegalStateException("Unsupported bucket plan: " + bucket.plan().getClass().getSimpleName());
    }

    private static RolloverEntry toEntry(UUID userId, Instant rolloverDate, BucketRolloverResult result) {
        UUID id = UUID.randomUUID();
        if (result instanceof BucketRolloverResult.SpendResult spend) {
            return new RolloverEntry(id, userId, spend.bucketId(), spend.bucketName(), spend.mode(), rolloverDate,
                    spend.previousCarryover(), spend.thisCycleFunding(), spend.totalSpent(), spend.unspent(),
                    spend.newFundedAmount(), spend.recomputed() ? "Recomputed from the previous cycle" : null);
        }
        if (result instanceof BucketRolloverResult.RecurringResult recurring) {
            return new RolloverEntry(id, userId, recurring.bucketId(), recurring.bucketName(), recurring.mode(),
                    rolloverDate, null, null, recurring.paymentAmount(), null, recurring.newFundedAmount(),
                    recurring.message());
        }
        BucketRolloverResult.SaveResult save = (BucketRolloverResult.SaveResult) result;
        return new RolloverEntry(id, userId, save.bucketId(), save.bucketName(), save.mode(), rolloverDate,
                save.previousBalance(), null, save.contribution(), save.newBalance(), null, save.message());
    }
}
