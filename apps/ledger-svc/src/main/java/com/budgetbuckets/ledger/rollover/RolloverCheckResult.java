package com.budgetbuckets.ledger.rollover;

import java.time.Instant;

public record RolloverCheckResult(
        boolean performed,
        Status status,
        String message,
        Instant checkedAt,
        Instant lastRolloverDate,
        RolloverReport report
) {

    public enum Status {
        PERFORMED,
        NOT_DUE,
        NO_BUCKETS,
        ALREADY_PROCESSED
    }

    static RolloverCheckResult performed(Instant checkedAt, RolloverReport report) {
        return new RolloverCheckResult(true, Status.PERFORMED, "Rollover performed", checkedAt, report.rolloverDate(), report);
    }

    static RolloverCheckResult skipped(Status status, String message, Instant checkedAt, Instant lastRolloverDate) {
        return new RolloverCheckResult(false, status, message, checkedAt, lastRolloverDate, null);
    }
}
