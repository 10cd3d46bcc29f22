package com.budgetbuckets.ledger.controller;

import com.budgetbuckets.ledger.allocation.SpendAggregator;
import com.budgetbuckets.ledger.controller.dto.ExpenseRequestDto;
import com.budgetbuckets.ledger.controller.dto.ExpenseResponseDto;
import com.budgetbuckets.ledger.controller.dto.ExpenseUpdateRequestDto;
import com.budgetbuckets.ledger.model.Expense;
import com.budgetbuckets.ledger.service.ExpenseChanges;
import com.budgetbuckets.ledger.service.ExpenseService;
import com.budgetbuckets.ledger.user.UserService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{userId}")
public class ExpensesController {

    private final ExpenseService expenseService;
    private final SpendAggregator spendAggregator;
    private final UserService userService;
    private final Clock clock;

    public ExpensesController(
            ExpenseService expenseService,
            SpendAggregator spendAggregator,
            UserService userService,
            Clock clock
    ) {
        this.expenseService = expenseService;
        this.spendAggregator = spendAggregator;
        this.userService = userService;
        this.clock = clock;
    }

    @GetMapping("/expenses")
    public ResponseEntity<List<ExpenseResponseDto>> listExpenses(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "bucketId", required = false) UUID bucketId
    ) {
        userService.requireUser(userId);
        return ResponseEntity.ok(expenseService.listExpenses(userId, bucketId).stream().map(this::map).toList());
    }

    @PostMapping("/expenses")
    public ResponseEntity<ExpenseResponseDto> createExpense(
            @PathVariable("userId") UUID userId,
            @RequestBody @Valid ExpenseRequestDto request
    ) {
        userService.requireUser(userId);
        Expense expense = expenseService.createExpense(userId, request.bucketId(), request.amount(), request.date(),
                request.note());
        return ResponseEntity.status(HttpStatus.CREATED).body(map(expense));
    }

    @PatchMapping("/expenses/{expenseId}")
    public ResponseEntity<ExpenseResponseDto> updateExpense(
            @PathVariable("userId") UUID userId,
            @PathVariable("expenseId") UUID expenseId,
            @RequestBody @Valid ExpenseUpdateRequestDto request
    ) {
        userService.requireUser(userId);
        Expense updated = expenseService.updateExpense(userId, expenseId,
                new ExpenseChanges(request.bucketId(), request.amount(), request.date(), request.note()));
        return ResponseEntity.ok(map(updated));
    }

    @DeleteMapping("/expenses/{expenseId}")
    public ResponseEntity<Void> deleteExpense(
            @PathVariable("userId") UUID userId,
            @PathVariable("expenseId") UUID expenseId
    ) {
        userService.requireUser(userId);
        expenseService.deleteExpense(userId, expenseId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Month defaults to the current one in the ledger zone.
     */
    @GetMapping("/spending")
    public ResponseEntity<SpendAggregator.MonthlySpending> monthlySpending(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "month", required = false) String month
    ) {
        userService.requireUser(userId);
        YearMonth focusMonth = BucketsController.parseMonth(month);
        if (focusMonth == null) {
            focusMonth = YearMonth.now(clock);
        }
        return ResponseEntity.ok(spendAggregator.monthlySpending(userId, focusMonth, clock.getZone()));
    }

    private ExpenseResponseDto map(Expense expense) {
        return new ExpenseResponseDto(
                expense.id().toString(),
                expense.userId().toString(),
                expense.bucketId().toString(),
                expense.amount(),
                expense.date(),
                expense.note(),
                expense.autoGenerated(),
                expense.createdAt(),
                expense.updatedAt()
        );
    }
}
