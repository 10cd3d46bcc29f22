package com.budgetbuckets.ledger.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record BalanceAdjustmentRequestDto(@NotNull BigDecimal amount) {
}
