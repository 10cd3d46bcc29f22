package com.budgetbuckets.ledger.controller.dto;

import com.budgetbuckets.ledger.model.AllocationType;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.ContributionType;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body of bucket create and update. Mode-specific rules are checked by the service.
 */
public record BucketRequestDto(
        @Size(max = 80) String name,
        BucketMode mode,
        AllocationType allocationType,
        BigDecimal allocationValue,
        BigDecimal targetAmount,
        ContributionType contributionType,
        BigDecimal contributionValue,
        CapBehavior capBehavior,
        UUID capRerouteBucketId,
        Integer alertThreshold,
        @Size(max = 32) String color,
        @Size(max = 64) String icon
) {
}
