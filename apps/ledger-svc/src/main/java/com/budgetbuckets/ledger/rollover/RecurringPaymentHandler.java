package com.budgetbuckets.ledger.rollover;

import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.Expense;
import com.budgetbuckets.ledger.model.RecurringPlan;
import com.budgetbuckets.ledger.repository.ExpenseRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pays a recurring bucket by appending one system-generated expense per month.
 */
@Component
public class RecurringPaymentHandler {

    private static final Logger log = LoggerFactory.getLogger(RecurringPaymentHandler.class);

    static final String PAYMENT_NOTE_PREFIX = "Automatic recurring payment - ";

    private final ExpenseRepository expenseRepository;

    public RecurringPaymentHandler(ExpenseRepository expenseRepository) {
        this.expenseRepository = expenseRepository;
    }

    BucketTransition apply(Bucket bucket, RecurringPlan plan, BigDecimal newFundedAmount, Instant now, ZoneId zone) {
        RecurringPlan next = plan.withFundedAmount(newFundedAmount);
        Bucket updated = bucket.withPlan(next).withLastRolloverDate(now);

        YearMonth month = YearMonth.from(now.atZone(zone));
        Instant monthStart = month.atDay(1).atStartOfDay(zone).toInstant();
        Instant monthEnd = month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant();

        if (expenseRepository.existsAutoGeneratedByBucketIdAndRange(bucket.id(), monthStart, monthEnd)) {
            log.debug("Recurring bucket {} already paid for {}", bucket.id(), month);
            return new BucketTransition(updated, result(bucket, newFundedAmount, BigDecimal.ZERO, null,
                    "Payment already recorded for " + month));
        }
        if (newFundedAmount.signum() <= 0) {
            return new BucketTransition(updated, result(bucket, newFundedAmount, BigDecimal.ZERO, null,
                    "No funding, no payment recorded"));
        }

        Expense payment = expenseRepository.save(new Expense(
                UUID.randomUUID(),
                bucket.userId(),
                bucket.id(),
                newFundedAmount,
                now,
                now,
                PAYMENT_NOTE_PREFIX + bucket.name(),
                true,
                now,
                now
        ));
        return new BucketTransition(updated, result(bucket, newFundedAmount, payment.amount(), payment.id(),
                "Payment of " + payment.amount() + " recorded"));
    }

    private static BucketRolloverResult.RecurringResult result(Bucket bucket, BigDecimal funded, BigDecimal paid,
                                                               UUID expenseId, String message) {
        return new BucketRolloverResult.RecurringResult(bucket.id(), bucket.name(), funded, paid, expenseId, message);
    }
}
