package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Inputs of the cycle closed by the most recent rollover. A repeated rollover in the same
 * month recomputes from these values so carryover is never added twice.
 *
 * @param cycleStart inclusive start of the closed cycle, null when it was the bucket's first
 * @param cycleEnd exclusive end of the closed cycle, the instant of that rollover
 */
public record RolloverBasis(
        BigDecimal previousCarryover,
        BigDecimal previousFunding,
        Instant cycleStart,
        Instant cycleEnd
) {
}
