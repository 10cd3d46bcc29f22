package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.Expense;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExpenseRepository {

    Expense save(Expense expense);

    Optional<Expense> findById(UUID expenseId);

    /** Newest first. */
    List<Expense> findByUserId(UUID userId);

    /** Newest first. */
    List<Expense> findByBucketId(UUID bucketId);

    List<Expense> findByUserIdAndRange(UUID userId, Instant fromInclusive, Instant toExclusive);

    /**
     * Sum of expense amounts of a bucket dated in the window. An empty bound leaves that side open.
     */
    BigDecimal sumAmountByBucketId(UUID bucketId, Optional<Instant> fromInclusive, Optional<Instant> toExclusive);

    /**
     * Same as {@link #sumAmountByBucketId} but windowed on {@code bookedAt}, the instant that
     * assigns an expense to a rollover cycle.
     */
    BigDecimal sumBookedAmountByBucketId(UUID bucketId, Optional<Instant> fromInclusive, Optional<Instant> toExclusive);

    boolean existsAutoGeneratedByBucketIdAndRange(UUID bucketId, Instant fromInclusive, Instant toExclusive);

    void deleteById(UUID expenseId);

    int deleteByUserId(UUID userId);
}
