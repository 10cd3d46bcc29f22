package com.budgetbuckets.ledger.controller.dto;

import com.budgetbuckets.ledger.model.AllocationType;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.ContributionType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BucketResponseDto(
        String id,
        String userId,
        String name,
        BucketMode mode,
        String color,
        String icon,
        int alertThreshold,
        boolean active,
        Instant createdAt,
        Instant lastRolloverDate,
        AllocationType allocationType,
        BigDecimal allocationValue,
        BigDecimal fundedAmount,
        BigDecimal carryoverBalance,
        BigDecimal targetAmount,
        BigDecimal currentBalance,
        ContributionType contributionType,
        BigDecimal contributionValue,
        CapBehavior capBehavior,
        String capRerouteBucketId,
        Instant lastContributionDate,
        BigDecimal spentAmount,
        BigDecimal availableAmount
) {
}
