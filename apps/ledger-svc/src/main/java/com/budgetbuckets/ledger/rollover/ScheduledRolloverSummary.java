package com.budgetbuckets.ledger.rollover;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ScheduledRolloverSummary(
        Instant processedAt,
        int totalUsers,
        int succeeded,
        int failed,
        List<UserOutcome> results
) {

    public record UserOutcome(
            UUID userId,
            String userName,
            boolean success,
            RolloverCheckResult.Status status,
            int bucketsProcessed,
            String error
    ) {
        static UserOutcome success(UUID userId, String userName, RolloverCheckResult result) {
            int processed = result.report() != null ? result.report().bucketsProcessed() : 0;
            return new UserOutcome(userId, userName, true, result.status(), processed, null);
        }

        static UserOutcome failure(UUID userId, String userName, String error) {
            return new UserOutcome(userId, userName, false, null, 0, error);
        }
    }
}
