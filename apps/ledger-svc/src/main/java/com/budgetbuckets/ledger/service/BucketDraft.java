package com.budgetbuckets.ledger.service;

import com.budgetbuckets.ledger.model.AllocationType;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.ContributionType;
import com.budgetbuckets.ledger.model.FundedPlan;
import com.budgetbuckets.ledger.model.SavePlan;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * User-supplied bucket settings. Any field may be null; on update a null keeps the current
 * value.
 */
public record BucketDraft(
        String name,
        BucketMode mode,
        AllocationType allocationType,
        BigDecimal allocationValue,
        BigDecimal targetAmount,
        ContributionType contributionType,
        BigDecimal contributionValue,
        CapBehavior capBehavior,
        UUID capRerouteBucketId,
        Integer alertThreshold,
        String color,
        String icon
) {

    static BucketDraft of(Bucket bucket) {
        AllocationType allocationType = null;
        BigDecimal allocationValue = null;
        BigDecimal targetAmount = null;
        ContributionType contributionType = null;
        BigDecimal contributionValue = null;
        CapBehavior capBehavior = null;
        UUID rerouteId = null;
        if (bucket.plan() instanceof FundedPlan funded) {
            allocationType = funded.allocation().type();
            allocationValue = funded.allocation().value();
        } else if (bucket.plan() instanceof SavePlan save) {
            targetAmount = save.targetAmount();
            contributionType = save.contribution().type();
            contributionValue = save.contribution().value();
            capBehavior = save.capBehavior();
            rerouteId = save.capRerouteBucketId();
        }
        return new BucketDraft(bucket.name(), bucket.mode(), allocationType, allocationValue, targetAmount,
                contributionType, contributionValue, capBehavior, rerouteId, bucket.alertThreshold(),
                bucket.color(), bucket.icon());
    }

    BucketDraft mergedOver(BucketDraft base) {
        return new BucketDraft(
                name != null ? name : base.name,
                mode != null ? mode : base.mode,
                allocationType != null ? allocationType : base.allocationType,
                allocationValue != null ? allocationValue : base.allocationValue,
                targetAmount != null ? targetAmount : base.targetAmount,
                contributionType != null ? contributionType : base.contributionType,
                contributionValue != null ? contributionValue : base.contributionValue,
                capBehavior != null ? capBehavior : base.capBehavior,
                capRerouteBucketId != null ? capRerouteBucketId : base.capRerouteBucketId,
                alertThreshold != null ? alertThreshold : base.alertThreshold,
                color != null ? color : base.color,
                icon != null ? icon : base.icon
        );
    }
}
