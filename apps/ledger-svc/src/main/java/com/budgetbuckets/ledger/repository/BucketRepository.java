package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.model.Bucket;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BucketRepository {

    Bucket save(Bucket bucket);

    Optional<Bucket> findById(UUID bucketId);

    /** Active buckets of the user, oldest first. */
    List<Bucket> findActiveByUserId(UUID userId);

    /**
     * Active buckets of the user, oldest first, write-locked until the surrounding transaction
     * ends. Writers of a user's bucket state go through here so they run one after another.
     */
    List<Bucket> lockActiveByUserId(UUID userId);

    /** All buckets of the user including soft-deleted ones, oldest first. */
    List<Bucket> findByUserId(UUID userId);

    int deleteByUserId(UUID userId);
}
