package com.budgetbuckets.ledger.allocation;

import com.budgetbuckets.ledger.model.Income;
import com.budgetbuckets.ledger.repository.IncomeRepository;
import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class IncomeAggregator {

    private final IncomeRepository incomeRepository;

    public IncomeAggregator(IncomeRepository incomeRepository) {
        this.incomeRepository = incomeRepository;
    }

    /**
     * Monthly income available for allocation. One-off income is ignored.
     */
    public BigDecimal totalRecurringIncome(UUID userId) {
        return incomeRepository.findRecurringByUserId(userId).stream()
                .map(Income::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
