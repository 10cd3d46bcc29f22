package com.budgetbuckets.ledger.allocation;

import com.budgetbuckets.ledger.error.SpendDerivationException;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.Expense;
import com.budgetbuckets.ledger.repository.BucketRepository;
import com.budgetbuckets.ledger.repository.ExpenseRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Derives spent amounts from the expense log. Nothing here is ever cached or stored on a
 * bucket; a failed read surfaces as {@link SpendDerivationException} instead of a zero.
 */
@Component
public class SpendAggregator {

    private final ExpenseRepository expenseRepository;
    private final BucketRepository bucketRepository;

    public SpendAggregator(ExpenseRepository expenseRepository, BucketRepository bucketRepository) {
        this.expenseRepository = expenseRepository;
        this.bucketRepository = bucketRepository;
    }

    public BigDecimal spentAmount(UUID bucketId) {
        return spentAmount(bucketId, null, null);
    }

    /**
     * @param fromInclusive window start, null for no lower bound
     * @param toExclusive window end, null for no upper bound
     */
    public BigDecimal spentAmount(UUID bucketId, Instant fromInclusive, Instant toExclusive) {
        try {
            return expenseRepository.sumAmountByBucketId(
                    bucketId,
                    Optional.ofNullable(fromInclusive),
                    Optional.ofNullable(toExclusive));
        } catch (DataAccessException ex) {
            throw new SpendDerivationException(bucketId, ex);
        }
    }

    /**
     * Spend charged to a rollover cycle. Unlike {@link #spentAmount(UUID, Instant, Instant)}
     * this windows on the booking instant, so an expense recorded late for an already closed
     * cycle is charged to the open one instead of falling between cycles.
     *
     * @param cycleStart null for a bucket that never rolled over
     * @param cycleEnd null for the open cycle
     */
    public BigDecimal cycleSpent(UUID bucketId, Instant cycleStart, Instant cycleEnd) {
        try {
            return expenseRepository.sumBookedAmountByBucketId(
                    bucketId,
                    Optional.ofNullable(cycleStart),
                    Optional.ofNullable(cycleEnd));
        } catch (DataAccessException ex) {
            throw new SpendDerivationException(bucketId, ex);
        }
    }

    /**
     * Spending of the month per active bucket. The month total only counts spend-mode
     * buckets, soft-deleted ones included, so recurring payments and savings stay out of it.
     */
    public MonthlySpending monthlySpending(UUID userId, YearMonth month, ZoneId zone) {
        Instant from = month.atDay(1).atStartOfDay(zone).toInstant();
        Instant to = month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant();

        List<Bucket> buckets = bucketRepository.findByUserId(userId);
        List<Expense> expenses = expenseRepository.findByUserIdAndRange(userId, from, to);

        Set<UUID> spendBucketIds = buckets.stream()
                .filter(bucket -> bucket.mode() == BucketMode.SPEND)
                .map(Bucket::id)
                .collect(Collectors.toSet());
        List<Expense> spendExpenses = expenses.stream()
                .filter(expense -> spendBucketIds.contains(expense.bucketId()))
                .toList();
        BigDecimal totalSpent = spendExpenses.stream()
                .map(Expense::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        Map<UUID, List<Expense>> byBucket = expenses.stream()
                .collect(Collectors.groupingBy(Expense::bucketId));
        List<BucketSpending> perBucket = buckets.stream()
                .filter(Bucket::active)
                .map(bucket -> {
                    List<Expense> bucketExpenses = byBucket.getOrDefault(bucket.id(), List.of());
                    BigDecimal spent = bucketExpenses.stream()
                            .map(Expense::amount)
                            .reduce(BigDecimal.ZERO, BigDecimal::add);
                    return new BucketSpending(bucket.id(), bucket.name(), bucket.mode(), spent, bucketExpenses.size());
                })
                .toList();

        return new MonthlySpending(month, totalSpent, spendExpenses.size(), perBucket);
    }

    public record MonthlySpending(YearMonth month, BigDecimal totalSpent, int transactionCount,
                                  List<BucketSpending> buckets) {
    }

    public record BucketSpending(UUID bucketId, String bucketName, BucketMode mode, BigDecimal spent,
                                 int transactionCount) {
    }
}
