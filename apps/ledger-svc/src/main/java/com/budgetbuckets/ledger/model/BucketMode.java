package com.budgetbuckets.ledger.model;

public enum BucketMode {
    SPEND,
    SAVE,
    RECURRING
}
