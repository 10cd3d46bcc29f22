package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.error.InvalidConfigurationException;
import com.budgetbuckets.ledger.error.ResourceNotFoundException;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.Expense;
import com.budgetbuckets.ledger.repository.BucketRepository;
import com.budgetbuckets.ledger.repository.ExpenseRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Expense log writes. Balances are never adjusted here: spend is re-derived from the log,
 * so an edit or delete refunds the bucket on the next read. Overspending is allowed.
 *
 * <p>An expense dated before the bucket's last rollover is booked into the open cycle. Once a
 * rollover has charged an expense to a closed cycle it stays booked there: later edits change
 * the log but cannot move it to another bucket.
 */
@Service
public class ExpenseService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    private final ExpenseRepository expenseRepository;
    private final BucketRepository bucketRepository;
    private final Clock clock;

    public ExpenseService(ExpenseRepository expenseRepository, BucketRepository bucketRepository, Clock clock) {
        this.expenseRepository = expenseRepository;
        this.bucketRepository = bucketRepository;
        this.clock = clock;
    }

    @Transactional
    public Expense createExpense(UUID userId, UUID bucketId, BigDecimal amount, Instant date, String note) {
        Bucket bucket = requireOwnedBucket(userId, bucketId);
        requireNonNegative(amount);
        Instant now = clock.instant();
        Instant expenseDate = date != null ? date : now;
        Instant bookedAt = Expense.bookingFor(expenseDate, bucket.lastRolloverDate());
        if (!bookedAt.equals(expenseDate)) {
            log.debug("Expense dated {} precedes the last rollover of bucket {}, booked at {}",
                    expenseDate, bucketId, bookedAt);
        }
        Expense expense = expenseRepository.save(new Expense(
                UUID.randomUUID(),
                userId,
                bucketId,
                amount,
                expenseDate,
                bookedAt,
                note,
                false,
                now,
                now
        ));
        log.debug("Recorded expense {} of {} in bucket {}", expense.id(), amount, bucketId);
        return expense;
    }

    @Transactional
    public Expense updateExpense(UUID userId, UUID expenseId, ExpenseChanges changes) {
        Expense existing = requireExpense(userId, expenseId);
        Bucket current = requireOwnedBucket(userId, existing.bucketId());
        Bucket target = changes.bucketId() != null ? requireOwnedBucket(userId, changes.bucketId()) : current;
        boolean settled = existing.settledBefore(current.lastRolloverDate());
        if (settled && !target.id().equals(current.id())) {
            throw new InvalidConfigurationException("bucketId",
                    "expense " + expenseId + " was already rolled over with its bucket and cannot be moved");
        }
        BigDecimal amount = changes.amount() != null ? changes.amount() : existing.amount();
        requireNonNegative(amount);
        Instant date = changes.date() != null ? changes.date() : existing.date();
        Expense updated = existing.withChanges(
                target.id(),
                amount,
                date,
                settled ? existing.bookedAt() : Expense.bookingFor(date, target.lastRolloverDate()),
                changes.note() != null ? changes.note() : existing.note(),
                clock.instant());
        return expenseRepository.save(updated);
    }

    @Transactional
    public void deleteExpense(UUID userId, UUID expenseId) {
        Expense existing = requireExpense(userId, expenseId);
        expenseRepository.deleteById(existing.id());
        log.debug("Deleted expense {} from bucket {}", expenseId, existing.bucketId());
    }

    /**
     * Newest first; limited to one bucket when {@code bucketId} is given.
     */
    @Transactional(readOnly = true)
    public List<Expense> listExpenses(UUID userId, UUID bucketId) {
        if (bucketId == null) {
            return expenseRepository.findByUserId(userId);
        }
        requireOwnedBucket(userId, bucketId);
        return expenseRepository.findByBucketId(bucketId);
    }

    private Expense requireExpense(UUID userId, UUID expenseId) {
        return expenseRepository.findById(expenseId)
                .filter(expense -> expense.userId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Expense", expenseId));
    }

    private Bucket requireOwnedBucket(UUID userId, UUID bucketId) {
        return bucketRepository.findById(bucketId)
                .filter(bucket -> bucket.userId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Bucket", bucketId));
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("expense amount must not be negative");
        }
    }
}
