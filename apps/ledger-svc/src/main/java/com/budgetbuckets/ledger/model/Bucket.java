package com.budgetbuckets.ledger.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Bucket(
        UUID id,
        UUID userId,
        String name,
        String color,
        String icon,
        int alertThreshold,
        boolean active,
        Instant createdAt,
        Instant lastRolloverDate,
        BucketPlan plan
) {
    public Bucket {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(plan, "plan");
    }

    public BucketMode mode() {
        return plan.mode();
    }

    public Bucket withPlan(BucketPlan newPlan) {
        return new Bucket(id, userId, name, color, icon, alertThreshold, active, createdAt, lastRolloverDate, newPlan);
    }

    public Bucket withActive(boolean newActive) {
        return new Bucket(id, userId, name, color, icon, alertThreshold, newActive, createdAt, lastRolloverDate, plan);
    }

    public Bucket withLastRolloverDate(Instant newLastRolloverDate) {
        return new Bucket(id, userId, name, color, icon, alertThreshold, active, createdAt, newLastRolloverDate, plan);
    }

    public Bucket withDetails(String newName, String newColor, String newIcon, int newAlertThreshold) {
        return new Bucket(id, userId, newName, newColor, newIcon, newAlertThreshold, active, createdAt, lastRolloverDate, plan);
    }
}
