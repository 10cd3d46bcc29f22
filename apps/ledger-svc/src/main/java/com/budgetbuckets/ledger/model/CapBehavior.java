package com.budgetbuckets.ledger.model;

/**
 * What a save bucket does with contributions once its target is reached.
 */
public enum CapBehavior {
    /** Clamp contributions so the balance never exceeds the target. */
    STOP,
    /** Keep contributing past the target; the overflow is reported, not moved. */
    UNALLOCATED,
    /** Reroute to {@code capRerouteBucketId}. Computed like {@link #STOP} for now. */
    BUCKET,
    /** Spread across spend buckets. Computed like {@link #STOP} for now. */
    PROPORTIONAL;

    public boolean clampsAtTarget() {
        return this != UNALLOCATED;
    }
}
