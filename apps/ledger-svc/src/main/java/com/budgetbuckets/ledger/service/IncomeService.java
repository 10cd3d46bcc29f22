package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.allocation.DistributionService;
import com.budgetbuckets.ledger.error.InvalidConfigurationException;
import com.budgetbuckets.ledger.error.ResourceNotFoundException;
import com.budgetbuckets.ledger.model.Income;
import com.budgetbuckets.ledger.repository.IncomeRepository;
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
 * Income entries are immutable; a correction is a delete plus a new entry. Both
 * redistribute the user's funding.
 */
@Service
public class IncomeService {

    private static final Logger log = LoggerFactory.getLogger(IncomeService.class);

    private final IncomeRepository incomeRepository;
    private final DistributionService distributionService;
    private final Clock clock;

    public IncomeService(IncomeRepository incomeRepository, DistributionService distributionService, Clock clock) {
        this.incomeRepository = incomeRepository;
        this.distributionService = distributionService;
        this.clock = clock;
    }

    @Transactional
    public Income addIncome(UUID userId, BigDecimal amount, Instant date, String note, boolean recurring) {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidConfigurationException("amount", "income amount must not be negative");
        }
        Instant now = clock.instant();
        Income income = incomeRepository.save(new Income(
                UUID.randomUUID(),
                userId,
                amount,
                date != null ? date : now,
                note,
                recurring,
                now
        ));
        log.info("Recorded {} income {} for user {}", recurring ? "recurring" : "one-off", income.id(), userId);
        distributionService.calculateDistribution(userId);
        return income;
    }

    @Transactional(readOnly = true)
    public List<Income> listIncome(UUID userId) {
        return incomeRepository.findByUserId(userId);
    }

    @Transactional
    public void deleteIncome(UUID userId, UUID incomeId) {
        Income income = incomeRepository.findById(incomeId)
                .filter(candidate -> candidate.userId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Income", incomeId));
        incomeRepository.deleteById(income.id());
        log.info("Deleted income {} for user {}", incomeId, userId);
        distributionService.calculateDistribution(userId);
    }
}
