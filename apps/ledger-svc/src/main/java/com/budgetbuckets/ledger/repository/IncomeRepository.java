package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.Income;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IncomeRepository {

    Income save(Income income);

    Optional<Income> findById(UUID incomeId);

    /** Newest first. */
    List<Income> findByUserId(UUID userId);

    List<Income> findRecurringByUserId(UUID userId);

    void deleteById(UUID incomeId);

    int deleteByUserId(UUID userId);
}
