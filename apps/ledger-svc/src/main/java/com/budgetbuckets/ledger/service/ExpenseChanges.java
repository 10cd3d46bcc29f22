package com.budgetbuckets.ledger.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Partial update of an expense; null fields stay as they are.
 */
public record ExpenseChanges(UUID bucketId, BigDecimal amount, Instant date, String note) {
}
