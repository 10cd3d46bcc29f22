package com.budgetbuckets.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One spending entry. {@code date} is the calendar date the user gave it; {@code bookedAt}
 * is the instant that decides which rollover cycle it is charged to. The two only differ for
 * entries dated inside a cycle that was already closed when they were recorded: those are
 * booked at the start of the open cycle.
 */
public record Expense(
        UUID id,
        UUID userId,
        UUID bucketId,
        BigDecimal amount,
        Instant date,
        Instant bookedAt,
        String note,
        boolean autoGenerated,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * @param openCycleStart start of the bucket's open cycle, null when it never rolled over
     */
    public static Instant bookingFor(Instant date, Instant openCycleStart) {
        if (openCycleStart != null && date.isBefore(openCycleStart)) {
            return openCycleStart;
        }
        return date;
    }

    /**
     * True once a rollover has already charged this expense to a closed cycle.
     */
    public boolean settledBefore(Instant openCycleStart) {
        return openCycleStart != null && bookedAt.isBefore(openCycleStart);
    }

    public Expense withChanges(UUID newBucketId, BigDecimal newAmount, Instant newDate, Instant newBookedAt,
                               String newNote, Instant changedAt) {
        return new Expense(
                id,
                userId,
                newBucketId,
                newAmount,
                newDate,
                newBookedAt,
                newNote,
                autoGenerated,
                createdAt,
                changedAt
        );
    }
}
