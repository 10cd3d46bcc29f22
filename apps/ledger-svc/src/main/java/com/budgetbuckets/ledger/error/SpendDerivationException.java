package com.budgetbuckets.ledger.error;

import java.util.UUID;

/**
 * Spend of a bucket could not be derived from its expenses. Retryable; callers must not
 * substitute zero.
 */
public class SpendDerivationException extends RuntimeException {

    private final UUID bucketId;

    public SpendDerivationException(UUID bucketId, Throwable cause) {
        super("Could not derive spent amount for bucket " + bucketId, cause);
        this.bucketId = bucketId;
    }

    public UUID getBucketId() {
        return bucketId;
    }
}
