package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.error.InvalidConfigurationException;
import com.budgetbuckets.ledger.model.Allocation;
import com.budgetbuckets.ledger.model.AllocationType;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.Contribution;
import com.budgetbuckets.ledger.model.ContributionType;
import com.budgetbuckets.ledger.repository.BucketRepository;
import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Rejects bucket settings the rollover could not process. Runs on every write.
 */
@Component
public class BucketConfigurationValidator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BucketRepository bucketRepository;

    public BucketConfigurationValidator(BucketRepository bucketRepository) {
        this.bucketRepository = bucketRepository;
    }

    /**
     * @param bucketId id of the bucket being written, null while creating
     */
    public void validate(UUID userId, UUID bucketId, BucketDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new InvalidConfigurationException("name", "name must not be blank");
        }
        if (draft.mode() == null) {
            throw new InvalidConfigurationException("mode", "mode is required");
        }
        if (draft.alertThreshold() != null && draft.alertThreshold() < 0) {
            throw new InvalidConfigurationException("alertThreshold", "alertThreshold must not be negative");
        }
        if (draft.mode() == BucketMode.SAVE) {
            validateSaving(userId, bucketId, draft);
        } else {
            validateAllocation(draft);
        }
    }

    Allocation allocation(BucketDraft draft) {
        return new Allocation(draft.allocationType(), draft.allocationValue());
    }

    Contribution contribution(BucketDraft draft) {
        ContributionType type = draft.contributionType();
        if (type == null || type == ContributionType.NONE) {
            return Contribution.none();
        }
        return new Contribution(type, draft.contributionValue());
    }

    private void validateAllocation(BucketDraft draft) {
        if (draft.allocationType() == null) {
            throw new InvalidConfigurationException("allocationType",
                    draft.mode() + " buckets need an allocation type");
        }
        if (draft.allocationValue() == null) {
            throw new InvalidConfigurationException("allocationValue",
                    draft.mode() + " buckets need an allocation value");
        }
        requireNonNegative("allocationValue", draft.allocationValue());
        if (draft.allocationType() == AllocationType.PERCENTAGE && draft.allocationValue().compareTo(HUNDRED) > 0) {
            throw new InvalidConfigurationException("allocationValue", "percentage allocation must not exceed 100");
        }
    }

    private void validateSaving(UUID userId, UUID bucketId, BucketDraft draft) {
        if (draft.targetAmount() != null) {
            requireNonNegative("targetAmount", draft.targetAmount());
        }
        ContributionType type = draft.contributionType();
        if (type == ContributionType.AMOUNT || type == ContributionType.PERCENTAGE) {
            if (draft.contributionValue() == null) {
                throw new InvalidConfigurationException("contributionValue",
                        "contribution type " + type + " needs a value");
            }
            requireNonNegative("contributionValue", draft.contributionValue());
            if (type == ContributionType.PERCENTAGE && draft.contributionValue().compareTo(HUNDRED) > 0) {
                throw new InvalidConfigurationException("contributionValue", "percentage contribution must not exceed 100");
            }
        }
        if (draft.capBehavior() == CapBehavior.BUCKET) {
            validateRerouteTarget(userId, bucketId, draft.capRerouteBucketId());
        }
    }

    private void validateRerouteTarget(UUID userId, UUID bucketId, UUID rerouteId) {
        if (rerouteId == null) {
            throw new InvalidConfigurationException("capRerouteBucketId",
                    "cap behavior BUCKET needs a reroute bucket");
        }
        if (rerouteId.equals(bucketId)) {
            throw new InvalidConfigurationException("capRerouteBucketId", "a bucket cannot reroute to itself");
        }
        boolean usable = bucketRepository.findById(rerouteId)
                .filter(bucket -> bucket.userId().equals(userId))
                .filter(Bucket::active)
                .isPresent();
        if (!usable) {
            throw new InvalidConfigurationException("capRerouteBucketId",
                    "reroute bucket " + rerouteId + " is not an active bucket of this user");
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value.signum() < 0) {
            throw new InvalidConfigurationException(field, field + " must not be negative");
        }
    }
}
