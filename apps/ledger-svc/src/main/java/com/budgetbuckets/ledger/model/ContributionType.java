package com.budgetbuckets.ledger.model;

public enum ContributionType {
    AMOUNT,
    PERCENTAGE,
    NONE
}
