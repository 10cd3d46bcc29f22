package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record Income(
        UUID id,
        UUID userId,
        BigDecimal amount,
        Instant date,
        String note,
        boolean recurring,
        Instant createdAt
) {
}
