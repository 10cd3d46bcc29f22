package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.model.Bucket;
import java.math.BigDecimal;

/**
 * A bucket with its derived figures. {@code availableAmount} is funding plus carryover minus
 * spend of the open cycle for funded buckets, the saved balance for save buckets.
 */
public record BucketView(Bucket bucket, BigDecimal spentAmount, BigDecimal availableAmount) {
}
