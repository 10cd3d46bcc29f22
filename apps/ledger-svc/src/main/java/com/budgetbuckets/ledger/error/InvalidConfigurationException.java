package com.budgetbuckets.ledger.error;

/**
 * Rejected bucket, income or expense change. Raised at write time so rollovers never see it.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final String field;

    public InvalidConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
