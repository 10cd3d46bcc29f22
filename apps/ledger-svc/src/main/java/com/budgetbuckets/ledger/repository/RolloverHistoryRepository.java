package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.RolloverEntry;
import java.util.List;
import java.util.UUID;

public interface RolloverHistoryRepository {

    List<RolloverEntry> saveAll(List<RolloverEntry> entries);

    /** Newest rollover first. */
    List<RolloverEntry> findByUserId(UUID userId);

    int deleteByUserId(UUID userId);
}
