package com.budgetbuckets.ledger.user;

import com.budgetbuckets.ledger.repository.BucketRepository;
import com.budgetbuckets.ledger.repository.ExpenseRepository;
import com.budgetbuckets.ledger.repository.IncomeRepository;
import com.budgetbuckets.ledger.repository.RolloverHistoryRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Wipes every budget record of a user. The user row itself survives so the account can
 * start over.
 */
@Service
public class UserDataResetService {

    private static final Logger log = LoggerFactory.getLogger(UserDataResetService.class);

    private final UserService userService;
    private final ExpenseRepository expenseRepository;
    private final BucketRepository bucketRepository;
    private final IncomeRepository incomeRepository;
    private final RolloverHistoryRepository rolloverHistoryRepository;

    public UserDataResetService(
            UserService userService,
            ExpenseRepository expenseRepository,
            BucketRepository bucketRepository,
            IncomeRepository incomeRepository,
            RolloverHistoryRepository rolloverHistoryRepository
    ) {
        this.userService = userService;
        this.expenseRepository = expenseRepository;
        this.bucketRepository = bucketRepository;
        this.incomeRepository = incomeRepository;
        this.rolloverHistoryRepository = rolloverHistoryRepository;
    }

    @Transactional
    public ResetSummary deleteAllUserData(UUID userId) {
        userService.requireUser(userId);

        int expenses = expenseRepository.deleteByUserId(userId);
        int rolloverEntries = rolloverHistoryRepository.deleteByUserId(userId);
        int buckets = bucketRepository.deleteByUserId(userId);
        int incomes = incomeRepository.deleteByUserId(userId);

        log.info("Reset data for user {}: {} buckets, {} income entries, {} expenses, {} rollover entries",
                userId, buckets, incomes, expenses, rolloverEntries);
        return new ResetSummary(userId, buckets, incomes, expenses, rolloverEntries);
    }

    public record ResetSummary(UUID userId, int bucketsDeleted, int incomesDeleted, int expensesDeleted,
                               int rolloverEntriesDeleted) {
    }
}
