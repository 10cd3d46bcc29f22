package com.budgetbuckets.ledger.allocation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Scales planned amounts down when planning exceeds income. Every bucket shrinks by the
 * same factor; there is no priority order.
 */
@Component
public class FundingRatioCalculator {

    static final int RATIO_SCALE = 6;
    static final int MONEY_SCALE = 2;

    /**
     * Returns {@code totalIncome / totalPlanned} when over-planned, otherwise exactly 1.
     */
    public BigDecimal fundingRatio(BigDecimal totalIncome, BigDecimal totalPlanned) {
        if (!isOverPlanned(totalIncome, totalPlanned)) {
            return BigDecimal.ONE;
        }
        return totalIncome.divide(totalPlanned, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Funded amount of one bucket, rounded to cents. Computed from the unrounded ratio so the
     * funded sum stays within half a cent per bucket of the income.
     */
    public BigDecimal funded(BigDecimal planned, BigDecimal totalIncome, BigDecimal totalPlanned) {
        if (!isOverPlanned(totalIncome, totalPlanned)) {
            return planned.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        }
        return planned.multiply(totalIncome).divide(totalPlanned, MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private boolean isOverPlanned(BigDecimal totalIncome, BigDecimal totalPlanned) {
        return totalPlanned.signum() > 0 && totalPlanned.compareTo(totalIncome) > 0;
    }
}
