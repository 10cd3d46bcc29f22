package com.budgetbuckets.ledger.rollover;

import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.SavePlan;
import com.budgetbuckets.ledger.rollover.BucketRolloverResult.ContributionStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Adds the monthly contribution to a save bucket, at most once per calendar month.
 */
@Component
public class SavingsContributionEngine {

    private static final Logger log = LoggerFactory.getLogger(SavingsContributionEngine.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BucketTransition apply(Bucket bucket, SavePlan plan, BigDecimal totalIncome, Instant now, ZoneId zone) {
        BigDecimal previous = plan.currentBalance();

        if (!plan.contribution().contributes()) {
            return unchanged(bucket, plan, now, ContributionStatus.NO_CONTRIBUTION, "No monthly contribution configured");
        }
        Instant lastContribution = plan.lastContributionDate();
        if (lastContribution != null
                && YearMonth.from(lastContribution.atZone(zone)).equals(YearMonth.from(now.atZone(zone)))) {
            log.debug("Save bucket {} already received its contribution this month", bucket.id());
            return unchanged(bucket, plan, now, ContributionStatus.ALREADY_CONTRIBUTED, "Already contributed this month");
        }

        BigDecimal monthly = plan.contribution().monthlyAmount(totalIncome).max(BigDecimal.ZERO);
        BigDecimal applied = monthly;
        if (plan.hasTarget() && plan.capBehavior().clampsAtTarget()) {
            BigDecimal room = plan.targetAmount().subtract(previous).max(BigDecimal.ZERO);
            applied = monthly.min(room);
            if (applied.compareTo(monthly) < 0 && plan.capBehavior() != CapBehavior.STOP) {
                log.warn("Save bucket {} has cap behavior {}; overflow of {} is not rerouted",
                        bucket.id(), plan.capBehavior(), monthly.subtract(applied));
            }
        }

        BigDecimal newBalance = previous.add(applied);
        SavePlan next = plan.withContributionApplied(newBalance, now);

        ContributionStatus status;
        String message;
        if (applied.signum() == 0 && plan.hasTarget() && previous.compareTo(plan.targetAmount()) >= 0) {
            status = ContributionStatus.TARGET_REACHED;
            message = "Goal already reached";
        } else {
            status = ContributionStatus.APPLIED;
            message = plan.hasTarget() && newBalance.compareTo(plan.targetAmount()) >= 0
                    ? "Contributed " + applied + "; goal reached"
                    : "Contributed " + applied;
        }

        BucketRolloverResult.SaveResult result = new BucketRolloverResult.SaveResult(
                bucket.id(),
                bucket.name(),
                previous,
                applied,
                newBalance,
                plan.targetAmount(),
                percentOfGoal(plan, newBalance),
                overTargetBy(plan, newBalance),
                status,
                message
        );
        return new BucketTransition(bucket.withPlan(next).withLastRolloverDate(now), result);
    }

    private BucketTransition unchanged(Bucket bucket, SavePlan plan, Instant now, ContributionStatus status, String message) {
        BigDecimal balance = plan.currentBalance();
        BucketRolloverResult.SaveResult result = new BucketRolloverResult.SaveResult(
                bucket.id(),
                bucket.name(),
                balance,
                BigDecimal.ZERO,
                balance,
                plan.targetAmount(),
                percentOfGoal(plan, balance),
                overTargetBy(plan, balance),
                status,
                message
        );
        return new BucketTransition(bucket.withLastRolloverDate(now), result);
    }

    private static BigDecimal percentOfGoal(SavePlan plan, BigDecimal balance) {
        if (!plan.hasTarget() || plan.targetAmount().signum() <= 0) {
            return null;
        }
        return balance.multiply(HUNDRED).divide(plan.targetAmount(), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal overTargetBy(SavePlan plan, BigDecimal balance) {
        if (!plan.hasTarget()) {
            return BigDecimal.ZERO;
        }
        return balance.subtract(plan.targetAmount()).max(BigDecimal.ZERO);
    }
}
