package com.budgetbuckets.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncomeResponseDto(
        String id,
        String userId,
        BigDecimal amount,
        Instant date,
        String note,
        boolean recurring,
        Instant createdAt
) {
}
