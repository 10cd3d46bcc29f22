package com.budgetbuckets.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpenseResponseDto(
        String id,
        String userId,
        String bucketId,
        BigDecimal amount,
        Instant date,
        String note,
        boolean autoGenerated,
        Instant createdAt,
        Instant updatedAt
) {
}
