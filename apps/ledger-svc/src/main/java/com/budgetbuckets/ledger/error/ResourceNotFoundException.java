package com.budgetbuckets.ledger.error;

import java.util.UUID;

/**
 * A referenced user, bucket, income or expense does not exist for the caller.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final UUID resourceId;

    public ResourceNotFoundException(String resource, UUID resourceId) {
        super(resource + " not found: " + resourceId);
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public String getResource() {
        return resource;
    }

    public UUID getResourceId() {
        return resourceId;
    }
}
