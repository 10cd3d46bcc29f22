package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.allocation.DistributionService;
import com.budgetbuckets.ledger.model.Allocation;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.SpendPlan;
import com.budgetbuckets.ledger.repository.BucketRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * One-time import of pre-mode buckets. Every row becomes a spend bucket; the old balance is
 * kept as carryover so the first distribution does not wipe it.
 */
@Service
public class LegacyBucketMigrationService {

    private static final Logger log = LoggerFactory.getLogger(LegacyBucketMigrationService.class);
    private static final int DEFAULT_ALERT_THRESHOLD = 80;

    private final BucketRepository bucketRepository;
    private final BucketConfigurationValidator validator;
    private final DistributionService distributionService;
    private final Clock clock;

    public LegacyBucketMigrationService(BucketRepository bucketRepository,
                                        BucketConfigurationValidator validator,
                                        DistributionService distributionService,
                                        Clock clock) {
        this.bucketRepository = bucketRepository;
        this.validator = validator;
        this.distributionService = distributionService;
        this.clock = clock;
    }

    @Transactional
    public MigrationResult migrateLegacyBuckets(UUID userId, List<LegacyBucketRow> rows) {
        List<BucketDraft> drafts = rows.stream().map(LegacyBucketMigrationService::toDraft).toList();
        // validate all rows first so a bad row imports nothing
        drafts.forEach(draft -> validator.validate(userId, null, draft));

        Instant now = clock.instant();
        List<UUID> created = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            LegacyBucketRow row = rows.get(i);
            BucketDraft draft = drafts.get(i);
            BigDecimal balance = row.currentBalance() != null ? row.currentBalance() : BigDecimal.ZERO;
            Bucket bucket = new Bucket(
                    UUID.randomUUID(),
                    userId,
                    draft.name().trim(),
                    draft.color(),
                    draft.icon(),
                    draft.alertThreshold(),
                    true,
                    now,
                    null,
                    new SpendPlan(new Allocation(row.allocationType(), row.allocationValue()), BigDecimal.ZERO, balance, null)
            );
            bucketRepository.save(bucket);
            created.add(bucket.id());
        }

        if (!created.isEmpty()) {
            distributionService.calculateDistribution(userId);
        }
        log.info("Migrated {} legacy buckets for user {}", created.size(), userId);
        return new MigrationResult(created.size(), List.copyOf(created));
    }

    private static BucketDraft toDraft(LegacyBucketRow row) {
        return new BucketDraft(
                row.name(),
                BucketMode.SPEND,
                row.allocationType(),
                row.allocationValue(),
                null,
                null,
                null,
                null,
                null,
                row.alertThreshold() != null ? row.alertThreshold() : DEFAULT_ALERT_THRESHOLD,
                row.color(),
                row.icon()
        );
    }

    public record MigrationResult(int migrated, List<UUID> bucketIds) {
    }
}
