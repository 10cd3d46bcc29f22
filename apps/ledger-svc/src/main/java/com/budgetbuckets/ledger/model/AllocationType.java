package com.budgetbuckets.ledger.model;

public enum AllocationType {
    AMOUNT,
    PERCENTAGE
}
