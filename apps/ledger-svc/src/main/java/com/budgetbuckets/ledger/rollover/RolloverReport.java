package com.budgetbuckets.ledger.rollover;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RolloverReport(
        UUID userId,
        Instant rolloverDate,
        int bucketsProcessed,
        List<BucketRolloverResult> results
) {
}
