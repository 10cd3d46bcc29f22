package com.budgetbuckets.ledger.controller.dto;

public record ResetResponseDto(
        String userId,
        int bucketsDeleted,
        int incomesDeleted,
        int expensesDeleted,
        int rolloverEntriesDeleted
) {
}
