package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.ExpenseEntity;
import com.budgetbuckets.ledger.model.Expense;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLExpenseRepository implements ExpenseRepository {

    // Stand-ins for an open window bound; JPQL has no portable "unbounded" parameter.
    private static final Instant EARLIEST = Instant.parse("1000-01-01T00:00:00Z");
    private static final Instant LATEST = Instant.parse("9999-12-31T00:00:00Z");

    private final JpaExpenseRepository jpaExpenseRepository;

    public PostgreSQLExpenseRepository(JpaExpenseRepository jpaExpenseRepository) {
        this.jpaExpenseRepository = jpaExpenseRepository;
    }

    @Override
    public Expense save(Expense expense) {
        ExpenseEntity saved = jpaExpenseRepository.save(toEntity(expense));
        return toModel(saved);
    }

    @Override
    public Optional<Expense> findById(UUID expenseId) {
        return jpaExpenseRepository.findById(expenseId).map(this::toModel);
    }

    @Override
    public List<Expense> findByUserId(UUID userId) {
        return jpaExpenseRepository.findByUserId(userId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public List<Expense> findByBucketId(UUID bucketId) {
        return jpaExpenseRepository.findByBucketId(bucketId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public List<Expense> findByUserIdAndRange(UUID userId, Instant fromInclusive, Instant toExclusive) {
        return jpaExpenseRepository.findByUserIdAndRange(userId, fromInclusive, toExclusive).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public BigDecimal sumAmountByBucketId(UUID bucketId, Optional<Instant> fromInclusive, Optional<Instant> toExclusive) {
        BigDecimal sum = jpaExpenseRepository.sumAmountByBucketIdAndRange(
                bucketId,
                fromInclusive.orElse(EARLIEST),
                toExclusive.orElse(LATEST));
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Override
    public BigDecimal sumBookedAmountByBucketId(UUID bucketId, Optional<Instant> fromInclusive, Optional<Instant> toExclusive) {
        BigDecimal sum = jpaExpenseRepository.sumBookedAmountByBucketIdAndRange(
                bucketId,
                fromInclusive.orElse(EARLIEST),
                toExclusive.orElse(LATEST));
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Override
    public boolean existsAutoGeneratedByBucketIdAndRange(UUID bucketId, Instant fromInclusive, Instant toExclusive) {
        return jpaExpenseRepository.countAutoGeneratedByBucketIdAndRange(bucketId, fromInclusive, toExclusive) > 0;
    }

    @Override
    public void deleteById(UUID expenseId) {
        jpaExpenseRepository.deleteById(expenseId);
    }

    @Override
    public int deleteByUserId(UUID userId) {
        return jpaExpenseRepository.deleteByUserId(userId);
    }

    private ExpenseEntity toEntity(Expense expense) {
        return new ExpenseEntity(
                expense.id(),
                expense.userId(),
                expense.bucketId(),
                expense.amount(),
                expense.date(),
                expense.bookedAt(),
                expense.note(),
                expense.autoGenerated(),
                expense.createdAt(),
                expense.updatedAt()
        );
    }

    private Expense toModel(ExpenseEntity entity) {
        return new Expense(
                entity.getId(),
                entity.getUserId(),
                entity.getBucketId(),
                entity.getAmount(),
                entity.getDate(),
                entity.getBookedAt(),
                entity.getNote(),
                entity.isAutoGenerated(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
