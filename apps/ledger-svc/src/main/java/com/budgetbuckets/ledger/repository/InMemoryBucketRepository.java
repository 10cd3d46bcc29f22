package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.Bucket;
import java.time.Instant;
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
public class InMemoryBucketRepository implements BucketRepository {

    private static final Comparator<Bucket> OLDEST_FIRST = Comparator
            .comparing(Bucket::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(bucket -> bucket.id().toString());

    private final Map<UUID, Bucket> storage = new ConcurrentHashMap<>();

    @Override
    public Bucket save(Bucket bucket) {
        storage.put(bucket.id(), bucket);
        return bucket;
    }

    @Override
    public Optional<Bucket> findById(UUID bucketId) {
        return Optional.ofNullable(storage.get(bucketId));
    }

    @Override
    public List<Bucket> findActiveByUserId(UUID userId) {
        return storage.values().stream()
                .filter(bucket -> bucket.userId().equals(userId))
                .filter(Bucket::active)
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    // No transactions here, nothing to hold a lock for.
    @Override
    public List<Bucket> lockActiveByUserId(UUID userId) {
        return findActiveByUserId(userId);
    }

    @Override
    public List<Bucket> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(bucket -> bucket.userId().equals(userId))
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public int deleteByUserId(UUID userId) {
        int before = storage.size();
        storage.entrySet().removeIf(entry -> entry.getValue().userId().equals(userId));
        return before - storage.size();
    }
}
