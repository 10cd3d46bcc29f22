package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.Income;
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
public class InMemoryIncomeRepository implements IncomeRepository {

    private final Map<UUID, Income> storage = new ConcurrentHashMap<>();

    @Override
    public Income save(Income income) {
        storage.put(income.id(), income);
        return income;
    }

    @Override
    public Optional<Income> findById(UUID incomeId) {
        return Optional.ofNullable(storage.get(incomeId));
    }

    @Override
    public List<Income> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(income -> income.userId().equals(userId))
                .sorted(Comparator.comparing(Income::date).reversed())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Income> findRecurringByUserId(UUID userId) {
        return findByUserId(userId).stream()
                .filter(Income::recurring)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void deleteById(UUID incomeId) {
        storage.remove(incomeId);
    }

    @Override
    public int deleteByUserId(UUID userId) {
        int before = storage.size();
        storage.entrySet().removeIf(entry -> entry.getValue().userId().equals(userId));
        return before - storage.size();
    }
}
