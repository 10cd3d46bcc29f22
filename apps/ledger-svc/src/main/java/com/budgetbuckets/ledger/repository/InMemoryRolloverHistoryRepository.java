package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.RolloverEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryRolloverHistoryRepository implements RolloverHistoryRepository {

    private final Map<UUID, RolloverEntry> storage = new ConcurrentHashMap<>();

    @Override
    public List<RolloverEntry> saveAll(List<RolloverEntry> entries) {
        entries.forEach(entry -> storage.put(entry.id(), entry));
        return List.copyOf(entries);
    }

    @Override
    public List<RolloverEntry> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(entry -> entry.userId().equals(userId))
                .sorted(Comparator.comparing(RolloverEntry::rolloverDate).reversed())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public int deleteByUserId(UUID userId) {
        int before = storage.size();
        storage.entrySet().removeIf(entry -> entry.getValue().userId().equals(userId));
        return before - storage.size();
    }
}
