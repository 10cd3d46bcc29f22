package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.model.AllocationType;
import java.math.BigDecimal;

/**
 * Bucket as stored before modes existed: one allocation value whose meaning depends on the
 * type, and a running balance.
 */
public record LegacyBucketRow(
        String name,
        AllocationType allocationType,
        BigDecimal allocationValue,
        BigDecimal currentBalance,
        String color,
        String icon,
        Integer alertThreshold
) {
}
