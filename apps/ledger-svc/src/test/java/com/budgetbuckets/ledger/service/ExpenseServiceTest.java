package com.budgetbuckets.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.budgetbuckets.ledger.error.InvalidConfigurationException;
import com.budgetbuckets.ledger.error.ResourceNotFoundException;
import com.budgetbuckets.ledger.model.Allocation;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.Expense;
import com.budgetbuckets.ledger.model.SpendPlan;
import com.budgetbuckets.ledger.repository.InMemoryBucketRepository;
import com.budgetbuckets.ledger.repository.InMemoryExpenseRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExpenseServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-12T17:45:00Z");
    private static final Instant JUNE_ROLLOVER = Instant.parse("2024-06-01T00:01:00Z");

    private InMemoryExpenseRepository expenseRepository;
    private InMemoryBucketRepository bucketRepository;
    private ExpenseService service;
    private final UUID userId = UUID.randomUUID();
    private Bucket food;
    private Bucket fun;

    @BeforeEach
    void setUp() {
        expenseRepository = new InMemoryExpenseRepository();
        bucketRepository = new InMemoryBucketRepository();
        service = new ExpenseService(expenseRepository, bucketRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        food = bucket("Food");
        fun = bucket("Fun");
    }

    @Test
    void expenseDefaultsToNow() {
        Expense expense = service.createExpense(userId, food.id(), new BigDecimal("42.10"), null, "Market");

        assertThat(expense.date()).isEqualTo(NOW);
        assertThat(expense.autoGenerated()).isFalse();
        assertThat(service.listExpenses(userId, food.id())).containsExactly(expense);
    }

    @Test
    void expenseIntoForeignBucketIsNotFound() {
        Bucket foreign = bucketRepository.save(new Bucket(UUID.randomUUID(), UUID.randomUUID(), "Theirs", null, null, 80,
                true, NOW, null, SpendPlan.fresh(Allocation.amount(BigDecimal.TEN))));

        assertThatThrownBy(() -> service.createExpense(userId, foreign.id(), BigDecimal.ONE, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void negativeExpenseIsRejected() {
        assertThatThrownBy(() -> service.createExpense(userId, food.id(), new BigDecimal("-5"), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateMovesExpenseBetweenBuckets() {
        Expense expense = service.createExpense(userId, food.id(), new BigDecimal("20"), Instant.parse("2024-06-01T10:00:00Z"), "Lunch");

        Expense moved = service.updateExpense(userId, expense.id(), new ExpenseChanges(fun.id(), new BigDecimal("25"), null, null));

        assertThat(moved.bucketId()).isEqualTo(fun.id());
        assertThat(moved.amount()).isEqualByComparingTo("25");
        assertThat(moved.note()).isEqualTo("Lunch");
        assertThat(moved.date()).isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
        assertThat(service.listExpenses(userId, food.id())).isEmpty();
        assertThat(service.listExpenses(userId, fun.id())).hasSize(1);
    }

    @Test
    void expenseDatedBeforeLastRolloverIsBookedIntoOpenCycle() {
        Bucket rolled = bucketRepository.save(food.withLastRolloverDate(JUNE_ROLLOVER));

        Expense expense = service.createExpense(userId, rolled.id(), new BigDecimal("60"),
                Instant.parse("2024-05-30T12:00:00Z"), "Late receipt");

        assertThat(expense.date()).isEqualTo(Instant.parse("2024-05-30T12:00:00Z"));
        assertThat(expense.bookedAt()).isEqualTo(JUNE_ROLLOVER);
    }

    @Test
    void movingDateIntoClosedCycleKeepsExpenseInOpenCycle() {
        Bucket rolled = bucketRepository.save(food.withLastRolloverDate(JUNE_ROLLOVER));
        Expense expense = service.createExpense(userId, rolled.id(), new BigDecimal("30"),
                Instant.parse("2024-06-05T12:00:00Z"), null);
        assertThat(expense.bookedAt()).isEqualTo(Instant.parse("2024-06-05T12:00:00Z"));

        Expense backdated = service.updateExpense(userId, expense.id(),
                new ExpenseChanges(null, null, Instant.parse("2024-05-20T12:00:00Z"), null));

        assertThat(backdated.date()).isEqualTo(Instant.parse("2024-05-20T12:00:00Z"));
        assertThat(backdated.bookedAt()).isEqualTo(JUNE_ROLLOVER);
    }

    @Test
    void rolledOverExpenseKeepsItsBookingAndBucket() {
        Expense expense = service.createExpense(userId, food.id(), new BigDecimal("40"),
                Instant.parse("2024-05-20T12:00:00Z"), null);
        bucketRepository.save(food.withLastRolloverDate(JUNE_ROLLOVER));

        assertThatThrownBy(() -> service.updateExpense(userId, expense.id(), new ExpenseChanges(fun.id(), null, null, null)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("cannot be moved");

        Expense corrected = service.updateExpense(userId, expense.id(),
                new ExpenseChanges(null, new BigDecimal("45"), Instant.parse("2024-06-10T12:00:00Z"), null));
        assertThat(corrected.amount()).isEqualByComparingTo("45");
        assertThat(corrected.bookedAt()).isEqualTo(Instant.parse("2024-05-20T12:00:00Z"));
    }

    @Test
    void deleteRemovesExpenseOfOwnerOnly() {
        Expense expense = service.createExpense(userId, food.id(), new BigDecimal("9.99"), null, null);
        UUID stranger = UUID.randomUUID();

        assertThatThrownBy(() -> service.deleteExpense(stranger, expense.id()))
                .isInstanceOf(ResourceNotFoundException.class);

        service.deleteExpense(userId, expense.id());
        assertThat(service.listExpenses(userId, null)).isEmpty();
    }

    private Bucket bucket(String name) {
        return bucketRepository.save(new Bucket(UUID.randomUUID(), userId, name, null, null, 80, true, NOW, null,
                SpendPlan.fresh(Allocation.amount(new BigDecimal("100")))));
    }
}
