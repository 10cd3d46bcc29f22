package com.budgetbuckets.ledger.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record ExpenseRequestDto(
        @NotNull UUID bucketId,
        @NotNull @DecimalMin("0.00") BigDecimal amount,
        Instant date,
        @Size(max = 255) String note
) {
}
