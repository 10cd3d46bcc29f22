package com.budgetbuckets.ledger.rollover;

import com.budgetbuckets.ledger.model.Bucket;

/**
 * Bucket state after its rollover, with the report line describing the change.
 */
record BucketTransition(Bucket bucket, BucketRolloverResult result) {
}
