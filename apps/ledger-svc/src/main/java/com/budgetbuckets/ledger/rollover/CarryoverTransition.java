package com.budgetbuckets.ledger.rollover;

import com.budgetbuckets.ledger.allocation.SpendAggregator;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.RolloverBasis;
import com.budgetbuckets.ledger.model.SpendPlan;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import org.springframework.stereotype.Component;

/**
 * Closes the cycle of a spend bucket: what was available minus what was spent carries
 * over, negative amounts included.
 */
@Component
public class CarryoverTransition {

    private final SpendAggregator spendAggregator;

    public CarryoverTransition(SpendAggregator spendAggregator) {
        this.spendAggregator = spendAggregator;
    }

    /**
     * The closed cycle spans from the end of the previous cycle up to {@code now}. When the
     * bucket was already rolled over this month the previous inputs are reused, so a second
     * run recomputes the same cycle instead of carrying it over twice.
     */
    BucketTransition apply(Bucket bucket, SpendPlan plan, BigDecimal newFundedAmount, Instant now, ZoneId zone) {
        RolloverBasis basis = plan.rolloverBasis();
        boolean recompute = basis != null && rolledOverInMonthOf(bucket, now, zone);

        BigDecimal previousCarryover;
        BigDecimal cycleFunding;
        Instant cycleStart;
        if (recompute) {
            previousCarryover = basis.previousCarryover();
            cycleFunding = basis.previousFunding();
            cycleStart = basis.cycleStart();
        } else {
            previousCarryover = plan.carryoverBalance();
            cycleFunding = plan.fundedAmount();
            cycleStart = basis != null ? basis.cycleEnd() : bucket.lastRolloverDate();
        }

        BigDecimal spent = spendAggregator.cycleSpent(bucket.id(), cycleStart, now);
        BigDecimal unspent = cycleFunding.add(previousCarryover).subtract(spent);

        RolloverBasis closed = new RolloverBasis(previousCarryover, cycleFunding, cycleStart, now);
        SpendPlan next = plan.withRollover(unspent, newFundedAmount, closed);

        BucketRolloverResult.SpendResult result = new BucketRolloverResult.SpendResult(
                bucket.id(),
                bucket.name(),
                previousCarryover,
                cycleFunding,
                spent,
                unspent,
                newFundedAmount,
                next.totalAvailable(),
                recompute
        );
        return new BucketTransition(bucket.withPlan(next).withLastRolloverDate(now), result);
    }

    private static boolean rolledOverInMonthOf(Bucket bucket, Instant now, ZoneId zone) {
        Instant last = bucket.lastRolloverDate();
        return last != null && YearMonth.from(last.atZone(zone)).equals(YearMonth.from(now.atZone(zone)));
    }
}
