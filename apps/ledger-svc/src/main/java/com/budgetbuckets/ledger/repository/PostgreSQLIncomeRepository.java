package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.IncomeEntity;
import com.budgetbuckets.ledger.model.Income;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLIncomeRepository implements IncomeRepository {

    private final JpaIncomeRepository jpaIncomeRepository;

    public PostgreSQLIncomeRepository(JpaIncomeRepository jpaIncomeRepository) {
        this.jpaIncomeRepository = jpaIncomeRepository;
    }

    @Override
    public Income save(Income income) {
        IncomeEntity saved = jpaIncomeRepository.save(toEntity(income));
        return toModel(saved);
    }

    @Override
    public Optional<Income> findById(UUID incomeId) {
        return jpaIncomeRepository.findById(incomeId).map(this::toModel);
    }

    @Override
    public List<Income> findByUserId(UUID userId) {
        return jpaIncomeRepository.findByUserId(userId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public List<Income> findRecurringByUserId(UUID userId) {
        return jpaIncomeRepository.findRecurringByUserId(userId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public void deleteById(UUID incomeId) {
        jpaIncomeRepository.deleteById(incomeId);
    }

    @Override
    public int deleteByUserId(UUID userId) {
        return jpaIncomeRepository.deleteByUserId(userId);
    }

    private IncomeEntity toEntity(Income income) {
        return new IncomeEntity(
                income.id(),
                income.userId(),
                income.amount(),
                income.date(),
                income.note(),
                income.recurring(),
                income.createdAt()
        );
    }

    private Income toModel(IncomeEntity entity) {
        return new Income(
                entity.getId(),
                entity.getUserId(),
                entity.getAmount(),
                entity.getDate(),
                entity.getNote(),
                entity.isRecurring(),
                entity.getCreatedAt()
        );
    }
}
