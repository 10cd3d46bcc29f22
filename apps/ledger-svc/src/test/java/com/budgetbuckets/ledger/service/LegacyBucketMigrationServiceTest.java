package com.budgetbuckets.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.budgetbuckets.ledger.allocation.AllocationPlanner;
import com.budgetbuckets.ledger.allocation.DistributionService;
import com.budgetbuckets.ledger.allocation.FundingRatioCalculator;
import com.budgetbuckets.ledger.allocation.IncomeAggregator;
import com.budgetbuckets.ledger.error.InvalidConfigurationException;
import com.budgetbuckets.ledger.model.AllocationType;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.Income;
import com.budgetbuckets.ledger.model.SpendPlan;
import com.budgetbuckets.ledger.repository.InMemoryBucketRepository;
import com.budgetbuckets.ledger.repository.InMemoryIncomeRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LegacyBucketMigrationServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-05T09:00:00Z");

    private InMemoryBucketRepository bucketRepository;
    private LegacyBucketMigrationService service;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        bucketRepository = new InMemoryBucketRepository();
        InMemoryIncomeRepository incomeRepository = new InMemoryIncomeRepository();
        incomeRepository.save(new Income(UUID.randomUUID(), userId, new BigDecimal("1000"), NOW, null, true, NOW));
        DistributionService distributionService = new DistributionService(
                new IncomeAggregator(incomeRepository),
                new AllocationPlanner(new FundingRatioCalculator()),
                bucketRepository);
        service = new LegacyBucketMigrationService(bucketRepository, new BucketConfigurationValidator(bucketRepository),
                distributionService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void legacyRowsBecomeFundedSpendBucketsKeepingTheirBalance() {
        LegacyBucketMigrationService.MigrationResult result = service.migrateLegacyBuckets(userId, List.of(
                new LegacyBucketRow("Food", AllocationType.PERCENTAGE, new BigDecimal("30"), new BigDecimal("85.50"), "#16a34a", null, null),
                new LegacyBucketRow("Gas", AllocationType.AMOUNT, new BigDecimal("120"), null, null, null, 60)));

        assertThat(result.migrated()).isEqualTo(2);
        List<Bucket> buckets = bucketRepository.findActiveByUserId(userId);
        assertThat(buckets).allSatisfy(bucket -> assertThat(bucket.mode()).isEqualTo(BucketMode.SPEND));
        Bucket food = buckets.stream().filter(bucket -> bucket.name().equals("Food")).findFirst().orElseThrow();
        SpendPlan foodPlan = (SpendPlan) food.plan();
        assertThat(foodPlan.carryoverBalance()).isEqualByComparingTo("85.50");
        assertThat(foodPlan.fundedAmount()).isEqualByComparingTo("300.00");
        assertThat(food.alertThreshold()).isEqualTo(80);
        Bucket gas = buckets.stream().filter(bucket -> bucket.name().equals("Gas")).findFirst().orElseThrow();
        assertThat(((SpendPlan) gas.plan()).carryoverBalance()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(gas.alertThreshold()).isEqualTo(60);
    }

    @Test
    void invalidRowImportsNothing() {
        List<LegacyBucketRow> rows = List.of(
                new LegacyBucketRow("Food", AllocationType.AMOUNT, new BigDecimal("100"), BigDecimal.ZERO, null, null, null),
                new LegacyBucketRow(" ", AllocationType.AMOUNT, new BigDecimal("50"), BigDecimal.ZERO, null, null, null));

        assertThatThrownBy(() -> service.migrateLegacyBuckets(userId, rows))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThat(bucketRepository.findByUserId(userId)).isEmpty();
    }
}
