package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.allocation.DistributionService;
import com.budgetbuckets.ledger.allocation.SpendAggregator;
import com.budgetbuckets.ledger.error.InvalidConfigurationException;
import com.budgetbuckets.ledger.error.ResourceNotFoundException;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketPlan;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.FundedPlan;
import com.budgetbuckets.ledger.model.RecurringPlan;
import com.budgetbuckets.ledger.model.SavePlan;
import com.budgetbuckets.ledger.model.SpendPlan;
import com.budgetbuckets.ledger.repository.BucketRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BucketService {

    private static final Logger log = LoggerFactory.getLogger(BucketService.class);
    private static final int DEFAULT_ALERT_THRESHOLD = 80;

    private final BucketRepository bucketRepository;
    private final BucketConfigurationValidator validator;
    private final DistributionService distributionService;
    private final SpendAggregator spendAggregator;
    private final Clock clock;

    public BucketService(BucketRepository bucketRepository,
                         BucketConfigurationValidator validator,
                         DistributionService distributionService,
                         SpendAggregator spendAggregator,
                         Clock clock) {
        this.bucketRepository = bucketRepository;
        this.validator = validator;
        this.distributionService = distributionService;
        this.spendAggregator = spendAggregator;
        this.clock = clock;
    }

    @Transactional
    public Bucket createBucket(UUID userId, BucketDraft draft) {
        validator.validate(userId, null, draft);
        Bucket bucket = new Bucket(
                UUID.randomUUID(),
                userId,
                draft.name().trim(),
                draft.color(),
                draft.icon(),
                draft.alertThreshold() != null ? draft.alertThreshold() : DEFAULT_ALERT_THRESHOLD,
                true,
                clock.instant(),
                null,
                freshPlan(draft)
        );
        bucketRepository.save(bucket);
        log.info("Created {} bucket {} for user {}", bucket.mode(), bucket.id(), userId);
        distributionService.calculateDistribution(userId);
        return requireBucket(userId, bucket.id());
    }

    /**
     * Applies the non-null fields of {@code changes}. Funding, carryover and saved balance are
     * kept; the mode of a bucket cannot change.
     */
    @Transactional
    public Bucket updateBucket(UUID userId, UUID bucketId, BucketDraft changes) {
        Bucket existing = requireBucket(userId, bucketId);
        if (changes.mode() != null && changes.mode() != existing.mode()) {
            throw new InvalidConfigurationException("mode",
                    "mode of bucket " + bucketId + " is " + existing.mode() + " and cannot change");
        }
        BucketDraft merged = changes.mergedOver(BucketDraft.of(existing));
        validator.validate(userId, bucketId, merged);

        Bucket updated = existing
                .withDetails(merged.name().trim(), merged.color(), merged.icon(), merged.alertThreshold())
                .withPlan(updatedPlan(existing.plan(), merged));
        bucketRepository.save(updated);
        distributionService.calculateDistribution(userId);
        return requireBucket(userId, bucketId);
    }

    /**
     * Soft delete. Expenses stay; the bucket leaves allocation and rollover.
     */
    @Transactional
    public void removeBucket(UUID userId, UUID bucketId) {
        Bucket existing = requireBucket(userId, bucketId);
        bucketRepository.save(existing.withActive(false));
        log.info("Deactivated bucket {} for user {}", bucketId, userId);
        distributionService.calculateDistribution(userId);
    }

    @Transactional(readOnly = true)
    public BucketView getBucket(UUID userId, UUID bucketId) {
        return view(requireBucket(userId, bucketId), null);
    }

    /**
     * Active buckets with derived spend. With a month, {@code spentAmount} covers that month;
     * otherwise the open cycle.
     */
    @Transactional(readOnly = true)
    public List<BucketView> listBuckets(UUID userId, YearMonth month) {
        return bucketRepository.findActiveByUserId(userId).stream()
                .map(bucket -> view(bucket, month))
                .toList();
    }

    /**
     * Manual deposit into or withdrawal from a save bucket.
     */
    @Transactional
    public Bucket adjustBalance(UUID userId, UUID bucketId, BigDecimal amount) {
        Bucket bucket = requireBucket(userId, bucketId);
        if (!(bucket.plan() instanceof SavePlan save)) {
            throw new InvalidConfigurationException("mode", "only SAVE buckets hold a balance");
        }
        BigDecimal newBalance = save.currentBalance().add(amount);
        if (newBalance.signum() < 0) {
            throw new InvalidConfigurationException("amount",
                    "adjustment of " + amount + " would make the balance negative");
        }
        log.info("Adjusted balance of bucket {} by {} to {}", bucketId, amount, newBalance);
        return bucketRepository.save(bucket.withPlan(save.withCurrentBalance(newBalance)));
    }

    Bucket requireBucket(UUID userId, UUID bucketId) {
        return bucketRepository.findById(bucketId)
                .filter(bucket -> bucket.userId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Bucket", bucketId));
    }

    private BucketView view(Bucket bucket, YearMonth month) {
        BucketPlan plan = bucket.plan();
        if (plan instanceof SavePlan save) {
            BigDecimal spent = month != null ? spentInMonth(bucket, month) : BigDecimal.ZERO;
            return new BucketView(bucket, spent, save.currentBalance());
        }
        FundedPlan funded = (FundedPlan) plan;
        Instant cycleStart = funded.rolloverBasis() != null
                ? funded.rolloverBasis().cycleEnd()
                : bucket.lastRolloverDate();
        BigDecimal cycleSpent = spendAggregator.cycleSpent(bucket.id(), cycleStart, null);
        BigDecimal available = funded.fundedAmount().add(funded.carryoverBalance()).subtract(cycleSpent);
        BigDecimal spent = month != null ? spentInMonth(bucket, month) : cycleSpent;
        return new BucketView(bucket, spent, available);
    }

    private BigDecimal spentInMonth(Bucket bucket, YearMonth month) {
        ZoneId zone = clock.getZone();
        return spendAggregator.spentAmount(
                bucket.id(),
                month.atDay(1).atStartOfDay(zone).toInstant(),
                month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant());
    }

    private BucketPlan freshPlan(BucketDraft draft) {
        return switch (draft.mode()) {
            case SPEND -> SpendPlan.fresh(validator.allocation(draft));
            case RECURRING -> RecurringPlan.fresh(validator.allocation(draft));
            case SAVE -> new SavePlan(
                    draft.targetAmount(),
                    BigDecimal.ZERO,
                    validator.contribution(draft),
                    draft.capBehavior() != null ? draft.capBehavior() : CapBehavior.STOP,
                    draft.capBehavior() == CapBehavior.BUCKET ? draft.capRerouteBucketId() : null,
                    null);
        };
    }

    private BucketPlan updatedPlan(BucketPlan current, BucketDraft merged) {
        if (current instanceof FundedPlan funded) {
            return funded.withAllocation(validator.allocation(merged));
        }
        SavePlan save = (SavePlan) current;
        CapBehavior cap = merged.capBehavior() != null ? merged.capBehavior() : CapBehavior.STOP;
        return save.withSettings(
                merged.targetAmount(),
                validator.contribution(merged),
                cap,
                cap == CapBehavior.BUCKET ? merged.capRerouteBucketId() : null);
    }
}
