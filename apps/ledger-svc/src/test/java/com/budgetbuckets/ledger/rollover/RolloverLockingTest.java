package com.budgetbuckets.ledger.rollover;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.budgetbuckets.ledger.model.Allocation;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.Contribution;
import com.budgetbuckets.ledger.model.Income;
import com.budgetbuckets.ledger.model.RecurringPlan;
import com.budgetbuckets.ledger.model.SavePlan;
import com.budgetbuckets.ledger.repository.BucketRepository;
import com.budgetbuckets.ledger.repository.ExpenseRepository;
import com.budgetbuckets.ledger.repository.IncomeRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
class RolloverLockingTest {

    @Autowired
    RolloverService rolloverService;

    @Autowired
    BucketRepository bucketRepository;

    @Autowired
    ExpenseRepository expenseRepository;

    @Autowired
    IncomeRepository incomeRepository;

    @Autowired
    PlatformTransactionManager transactionManager;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final UUID userId = UUID.randomUUID();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void rolloverWaitsWhileAnotherTransactionHoldsTheUsersBuckets() throws Exception {
        Bucket savings = bucketRepository.save(saveBucket());
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> tx.executeWithoutResult(status -> {
            bucketRepository.lockActiveByUserId(userId);
            locked.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }));
        assertThat(locked.await(10, TimeUnit.SECONDS)).isTrue();

        Future<RolloverReport> rollover = executor.submit(() -> rolloverService.performMonthlyRollover(userId));
        assertThatThrownBy(() -> rollover.get(500, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

        release.countDown();
        holder.get(10, TimeUnit.SECONDS);
        RolloverReport report = rollover.get(10, TimeUnit.SECONDS);

        assertThat(report.bucketsProcessed()).isEqualTo(1);
        SavePlan plan = (SavePlan) bucketRepository.findById(savings.id()).orElseThrow().plan();
        assertThat(plan.currentBalance()).isEqualByComparingTo("200");
    }

    @Test
    void racingRolloversContributeAndPayOnlyOnce() throws Exception {
        Instant now = Instant.now();
        incomeRepository.save(new Income(UUID.randomUUID(), userId, new BigDecimal("1000"), now, "Salary", true, now));
        Bucket savings = bucketRepository.save(saveBucket());
        Bucket insurance = bucketRepository.save(new Bucket(UUID.randomUUID(), userId, "Insurance", null, null, 80, true,
                now, null, RecurringPlan.fresh(Allocation.amount(new BigDecimal("120")))));
        CountDownLatch start = new CountDownLatch(1);

        List<Future<RolloverReport>> runs = List.of(
                executor.submit(() -> {
                    start.await();
                    return rolloverService.manualRollover(userId);
                }),
                executor.submit(() -> {
                    start.await();
                    return rolloverService.performMonthlyRollover(userId);
                }));
        start.countDown();

        BigDecimal contributed = BigDecimal.ZERO;
        for (Future<RolloverReport> run : runs) {
            for (BucketRolloverResult result : run.get(10, TimeUnit.SECONDS).results()) {
                if (result instanceof BucketRolloverResult.SaveResult save) {
                    contributed = contributed.add(save.contribution());
                }
            }
        }

        assertThat(contributed).isEqualByComparingTo("200");
        SavePlan plan = (SavePlan) bucketRepository.findById(savings.id()).orElseThrow().plan();
        assertThat(plan.currentBalance()).isEqualByComparingTo("200");
        assertThat(expenseRepository.findByBucketId(insurance.id())).hasSize(1);
    }

    private Bucket saveBucket() {
        return new Bucket(UUID.randomUUID(), userId, "Emergency fund", null, null, 80, true, Instant.now(), null,
                new SavePlan(new BigDecimal("5000"), BigDecimal.ZERO, Contribution.amount(new BigDecimal("200")),
                        CapBehavior.STOP, null, null));
    }
}
