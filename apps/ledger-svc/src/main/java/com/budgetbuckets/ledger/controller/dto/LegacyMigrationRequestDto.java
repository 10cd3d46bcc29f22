package com.budgetbuckets.ledger.controller.dto;

import com.budgetbuckets.ledger.model.AllocationType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;

public record LegacyMigrationRequestDto(
        @NotEmpty List<@Valid LegacyBucketDto> buckets
) {
    public record LegacyBucketDto(
            String name,
            @NotNull AllocationType allocationType,
            @NotNull BigDecimal allocationValue,
            BigDecimal currentBalance,
            String color,
            String icon,
            Integer alertThreshold
    ) {
    }
}
