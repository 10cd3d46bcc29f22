package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.Expense;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryExpenseRepository implements ExpenseRepository {

    private final Map<UUID, Expense> storage = new ConcurrentHashMap<>();

    @Override
    public Expense save(Expense expense) {
        storage.put(expense.id(), expense);
        return expense;
    }

    @Override
    public Optional<Expense> findById(UUID expenseId) {
        return Optional.ofNullable(storage.get(expenseId));
    }

    @Override
    public List<Expense> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(expense -> expense.userId().equals(userId))
                .sorted(Comparator.comparing(Expense::date).reversed())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Expense> findByBucketId(UUID bucketId) {
        return storage.values().stream()
                .filter(expense -> expense.bucketId().equals(bucketId))
                .sorted(Comparator.comparing(Expense::date).reversed())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Expense> findByUserIdAndRange(UUID userId, Instant fromInclusive, Instant toExclusive) {
        return findByUserId(userId).stream()
                .filter(expense -> !expense.date().isBefore(fromInclusive) && expense.date().isBefore(toExclusive))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public BigDecimal sumAmountByBucketId(UUID bucketId, Optional<Instant> fromInclusive, Optional<Instant> toExclusive) {
        return storage.values().stream()
                .filter(expense -> expense.bucketId().equals(bucketId))
                .filter(expense -> fromInclusive.map(from -> !expense.date().isBefore(from)).orElse(true))
                .filter(expense -> toExclusive.map(to -> expense.date().isBefore(to)).orElse(true))
                .map(Expense::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public BigDecimal sumBookedAmountByBucketId(UUID bucketId, Optional<Instant> fromInclusive, Optional<Instant> toExclusive) {
        return storage.values().stream()
                .filter(expense -> expense.bucketId().equals(bucketId))
                .filter(expense -> fromInclusive.map(from -> !expense.bookedAt().isBefore(from)).orElse(true))
                .filter(expense -> toExclusive.map(to -> expense.bookedAt().isBefore(to)).orElse(true))
                .map(Expense::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public boolean existsAutoGeneratedByBucketIdAndRange(UUID bucketId, Instant fromInclusive, Instant toExclusive) {
        return storage.values().stream()
                .filter(expense -> expense.bucketId().equals(bucketId))
                .filter(Expense::autoGenerated)
                .anyMatch(expense -> !expense.date().isBefore(fromInclusive) && expense.date().isBefore(toExclusive));
    }

    @Override
    public void deleteById(UUID expenseId) {
        storage.remove(expenseId);
    }

    @Override
    public int deleteByUserId(UUID userId) {
        int before = storage.size();
        storage.entrySet().removeIf(entry -> entry.getValue().userId().equals(userId));
        return before - storage.size();
    }
}
