package com.budgetbuckets.ledger.rollover;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetbuckets.ledger.allocation.AllocationPlanner;
import com.budgetbuckets.ledger.allocation.FundingRatioCalculator;
import com.budgetbuckets.ledger.allocation.IncomeAggregator;
import com.budgetbuckets.ledger.allocation.SpendAggregator;
import com.budgetbuckets.ledger.model.Allocation;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.BucketPlan;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.Contribution;
import com.budgetbuckets.ledger.model.Expense;
import com.budgetbuckets.ledger.model.Income;
import com.budgetbuckets.ledger.model.RecurringPlan;
import com.budgetbuckets.ledger.model.RolloverEntry;
import com.budgetbuckets.ledger.model.SavePlan;
import com.budgetbuckets.ledger.model.SpendPlan;
import com.budgetbuckets.ledger.repository.InMemoryBucketRepository;
import com.budgetbuckets.ledger.repository.InMemoryExpenseRepository;
import com.budgetbuckets.ledger.repository.InMemoryIncomeRepository;
import com.budgetbuckets.ledger.repository.InMemoryRolloverHistoryRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RolloverServiceTest {

    private static final Instant FIRST_OF_JUNE = Instant.parse("2024-06-01T00:01:00Z");

    private InMemoryBucketRepository bucketRepository;
    private InMemoryIncomeRepository incomeRepository;
    private InMemoryExpenseRepository expenseRepository;
    private InMemoryRolloverHistoryRepository historyRepository;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        bucketRepository = new InMemoryBucketRepository();
        incomeRepository = new InMemoryIncomeRepository();
        expenseRepository = new InMemoryExpenseRepository();
        historyRepository = new InMemoryRolloverHistoryRepository();
        Instant paid = Instant.parse("2024-05-01T09:00:00Z");
        incomeRepository.save(new Income(UUID.randomUUID(), userId, new BigDecimal("1000"), paid, "Salary", true, paid));
    }

    @Test
    void checkIsNotDueOutsideFirstDayOfMonth() {
        bucket("Food", SpendPlan.fresh(Allocation.amount(new BigDecimal("300"))));

        RolloverCheckResult result = service(Instant.parse("2024-06-15T10:00:00Z")).checkAndPerformRollover(userId);

        assertThat(result.performed()).isFalse();
        assertThat(result.status()).isEqualTo(RolloverCheckResult.Status.NOT_DUE);
        assertThat(historyRepository.findByUserId(userId)).isEmpty();
    }

    @Test
    void checkWithoutBucketsDoesNothing() {
        RolloverCheckResult result = service(FIRST_OF_JUNE).checkAndPerformRollover(userId);

        assertThat(result.status()).isEqualTo(RolloverCheckResult.Status.NO_BUCKETS);
        assertThat(result.report()).isNull();
    }

    @Test
    void checkRunsOncePerMonth() {
        bucket("Food", SpendPlan.fresh(Allocation.amount(new BigDecimal("300"))));
        RolloverService service = service(FIRST_OF_JUNE);

        RolloverCheckResult first = service.checkAndPerformRollover(userId);
        RolloverCheckResult second = service.checkAndPerformRollover(userId);

        assertThat(first.performed()).isTrue();
        assertThat(first.status()).isEqualTo(RolloverCheckResult.Status.PERFORMED);
        assertThat(first.report().bucketsProcessed()).isEqualTo(1);
        assertThat(second.performed()).isFalse();
        assertThat(second.status()).isEqualTo(RolloverCheckResult.Status.ALREADY_PROCESSED);
        assertThat(second.lastRolloverDate()).isEqualTo(FIRST_OF_JUNE);
    }

    @Test
    void rollsOverEveryModeAndRecordsHistory() {
        Bucket food = bucket("Food", new SpendPlan(Allocation.amount(new BigDecimal("400")), new BigDecimal("400"), BigDecimal.ZERO, null));
        Bucket phone = bucket("Phone", new RecurringPlan(Allocation.amount(new BigDecimal("50")), new BigDecimal("50"), BigDecimal.ZERO, null));
        Bucket savings = bucket("Savings", new SavePlan(new BigDecimal("5000"), new BigDecimal("1000"),
                Contribution.percentage(new BigDecimal("10")), CapBehavior.STOP, null, null));
        Instant spentAt = Instant.parse("2024-05-18T19:00:00Z");
        expenseRepository.save(new Expense(UUID.randomUUID(), userId, food.id(), new BigDecimal("250"), spentAt, spentAt, null,
                false, spentAt, spentAt));

        RolloverReport report = service(FIRST_OF_JUNE).performMonthlyRollover(userId);

        assertThat(report.bucketsProcessed()).isEqualTo(3);
        assertThat(report.rolloverDate()).isEqualTo(FIRST_OF_JUNE);
        assertThat(carryover(food)).isEqualByComparingTo("150");
        assertThat(expenseRepository.findByBucketId(phone.id()))
                .singleElement()
                .satisfies(expense -> assertThat(expense.autoGenerated()).isTrue());
        assertThat(balance(savings)).isEqualByComparingTo("1100");

        List<RolloverEntry> history = service(FIRST_OF_JUNE).getHistory(userId);
        assertThat(history).hasSize(3);
        assertThat(history)
                .filteredOn(entry -> entry.mode() == BucketMode.SPEND)
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.openingAmount()).isEqualByComparingTo(BigDecimal.ZERO);
                    assertThat(entry.movedAmount()).isEqualByComparingTo("250");
                    assertThat(entry.closingAmount()).isEqualByComparingTo("150");
                });
    }

    @Test
    void repeatedRolloverInSameMonthIsIdempotent() {
        Bucket food = bucket("Food", new SpendPlan(Allocation.amount(new BigDecimal("400")), new BigDecimal("400"), BigDecimal.ZERO, null));
        Bucket phone = bucket("Phone", new RecurringPlan(Allocation.amount(new BigDecimal("50")), new BigDecimal("50"), BigDecimal.ZERO, null));
        Bucket savings = bucket("Savings", new SavePlan(null, new BigDecimal("1000"),
                Contribution.amount(new BigDecimal("200")), CapBehavior.STOP, null, null));

        service(FIRST_OF_JUNE).manualRollover(userId);
        service(Instant.parse("2024-06-01T12:00:00Z")).manualRollover(userId);

        assertThat(carryover(food)).isEqualByComparingTo("400");
        assertThat(expenseRepository.findByBucketId(phone.id())).hasSize(1);
        assertThat(balance(savings)).isEqualByComparingTo("1200");
    }

    @Test
    void overPlannedIncomeFundsNextCycleByRatio() {
        Bucket rent = bucket("Rent", SpendPlan.fresh(Allocation.amount(new BigDecimal("700"))));
        Bucket food = bucket("Food", SpendPlan.fresh(Allocation.amount(new BigDecimal("500"))));

        service(FIRST_OF_JUNE).performMonthlyRollover(userId);

        assertThat(funded(rent)).isEqualByComparingTo("583.33");
        assertThat(funded(food)).isEqualByComparingTo("416.67");
    }

    @Test
    void inactiveBucketsAreSkipped() {
        Bucket old = bucketRepository.save(new Bucket(UUID.randomUUID(), userId, "Old", "#64748b", null, 80, false,
                Instant.parse("2024-01-01T00:00:00Z"), null,
                new SpendPlan(Allocation.amount(new BigDecimal("100")), new BigDecimal("100"), BigDecimal.ZERO, null)));
        bucket("Food", SpendPlan.fresh(Allocation.amount(new BigDecimal("100"))));

        RolloverReport report = service(FIRST_OF_JUNE).performMonthlyRollover(userId);

        assertThat(report.bucketsProcessed()).isEqualTo(1);
        assertThat(bucketRepository.findById(old.id()).orElseThrow().lastRolloverDate()).isNull();
    }

    private RolloverService service(Instant now) {
        SpendAggregator spendAggregator = new SpendAggregator(expenseRepository, bucketRepository);
        return new RolloverService(
                bucketRepository,
                historyRepository,
                new IncomeAggregator(incomeRepository),
                new AllocationPlanner(new FundingRatioCalculator()),
                new CarryoverTransition(spendAggregator),
                new RecurringPaymentHandler(expenseRepository),
                new SavingsContributionEngine(),
                Clock.fixed(now, ZoneOffset.UTC)
        );
    }

    private Bucket bucket(String name, BucketPlan plan) {
        return bucketRepository.save(new Bucket(UUID.randomUUID(), userId, name, "#0ea5e9", null, 80, true,
                Instant.parse("2024-05-01T08:00:00Z"), null, plan));
    }

    private BigDecimal carryover(Bucket bucket) {
        return ((SpendPlan) bucketRepository.findById(bucket.id()).orElseThrow().plan()).carryoverBalance();
    }

    private BigDecimal funded(Bucket bucket) {
        return ((SpendPlan) bucketRepository.findById(bucket.id()).orElseThrow().plan()).fundedAmount();
    }

    private BigDecimal balance(Bucket bucket) {
        return ((SavePlan) bucketRepository.findById(bucket.id()).orElseThrow().plan()).currentBalance();
    }
}
