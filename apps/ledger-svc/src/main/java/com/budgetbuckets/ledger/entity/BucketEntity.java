package com.budgetbuckets.ledger.entity;

import com.budgetbuckets.ledger.model.AllocationType;
import com.budgetbuckets.ledger.model.BucketMode;
import com.budgetbuckets.ledger.model.CapBehavior;
import com.budgetbuckets.ledger.model.ContributionType;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Flat row of a bucket. Columns of the modes a bucket is not in stay null.
 */
@Entity
@Table(name = "buckets", indexes = @Index(name = "idx_buckets_user", columnList = "user_id"))
public class BucketEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "color")
    private String color;

    @Column(name = "icon")
    private String icon;

    @Column(name = "alert_threshold", nullable = false)
    private int alertThreshold;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_rollover_date")
    private Instant lastRolloverDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "bucket_mode", nullable = false, length = 16)
    private BucketMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "allocation_type", length = 16)
    private AllocationType allocationType;

    @Column(name = "allocation_value", precision = 14, scale = 4)
    private BigDecimal allocationValue;

    @Column(name = "funded_amount", precision = 14, scale = 2)
    private BigDecimal fundedAmount;

    @Column(name = "carryover_balance", precision = 14, scale = 2)
    private BigDecimal carryoverBalance;

    @Column(name = "basis_previous_carryover", precision = 14, scale = 2)
    private BigDecimal basisPreviousCarryover;

    @Column(name = "basis_previous_funding", precision = 14, scale = 2)
    private BigDecimal basisPreviousFunding;

    @Column(name = "basis_cycle_start")
    private Instant basisCycleStart;

    @Column(name = "basis_cycle_end")
    private Instant basisCycleEnd;

    @Column(name = "target_amount", precision = 14, scale = 2)
    private BigDecimal targetAmount;

    @Column(name = "current_balance", precision = 14, scale = 2)
    private BigDecimal currentBalance;

    @Enumerated(EnumType.STRING)
    @Column(name = "contribution_type", length = 16)
    private ContributionType contributionType;

    @Column(name = "contribution_value", precision = 14, scale = 4)
    private BigDecimal contributionValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "cap_behavior", length = 16)
    private CapBehavior capBehavior;

    @Column(name = "cap_reroute_bucket_id")
    private UUID capRerouteBucketId;

    @Column(name = "last_contribution_date")
    private Instant lastContributionDate;

    // Default constructor for JPA
    public BucketEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public String getIcon() { return icon; }
    public void setIcon(String icon) { this.icon = icon; }

    public int getAlertThreshold() { return alertThreshold; }
    public void setAlertThreshold(int alertThreshold) { this.alertThreshold = alertThreshold; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastRolloverDate() { return lastRolloverDate; }
    public void setLastRolloverDate(Instant lastRolloverDate) { this.lastRolloverDate = lastRolloverDate; }

    public BucketMode getMode() { return mode; }
    public void setMode(BucketMode mode) { this.mode = mode; }

    public AllocationType getAllocationType() { return allocationType; }
    public void setAllocationType(AllocationType allocationType) { this.allocationType = allocationType; }

    public BigDecimal getAllocationValue() { return allocationValue; }
    public void setAllocationValue(BigDecimal allocationValue) { this.allocationValue = allocationValue; }

    public BigDecimal getFundedAmount() { return fundedAmount; }
    public void setFundedAmount(BigDecimal fundedAmount) { this.fundedAmount = fundedAmount; }

    public BigDecimal getCarryoverBalance() { return carryoverBalance; }
    public void setCarryoverBalance(BigDecimal carryoverBalance) { this.carryoverBalance = carryoverBalance; }

    public BigDecimal getBasisPreviousCarryover() { return basisPreviousCarryover; }
    public void setBasisPreviousCarryover(BigDecimal basisPreviousCarryover) { this.basisPreviousCarryover = basisPreviousCarryover; }

    public BigDecimal getBasisPreviousFunding() { return basisPreviousFunding; }
    public void setBasisPreviousFunding(BigDecimal basisPreviousFunding) { this.basisPreviousFunding = basisPreviousFunding; }

    public Instant getBasisCycleStart() { return basisCycleStart; }
    public void setBasisCycleStart(Instant basisCycleStart) { this.basisCycleStart = basisCycleStart; }

    public Instant getBasisCycleEnd() { return basisCycleEnd; }
    public void setBasisCycleEnd(Instant basisCycleEnd) { this.basisCycleEnd = basisCycleEnd; }

    public BigDecimal getTargetAmount() { return targetAmount; }
    public void setTargetAmount(BigDecimal targetAmount) { this.targetAmount = targetAmount; }

    public BigDecimal getCurrentBalance() { return currentBalance; }
    public void setCurrentBalance(BigDecimal currentBalance) { this.currentBalance = currentBalance; }

    public ContributionType getContributionType() { return contributionType; }
    public void setContributionType(ContributionType contributionType) { this.contributionType = contributionType; }

    public BigDecimal getContributionValue() { return contributionValue; }
    public void setContributionValue(BigDecimal contributionValue) { this.contributionValue = contributionValue; }

    public CapBehavior getCapBehavior() { return capBehavior; }
    public void setCapBehavior(CapBehavior capBehavior) { this.capBehavior = capBehavior; }

    public UUID getCapRerouteBucketId() { return capRerouteBucketId; }
    public void setCapRerouteBucketId(UUID capRerouteBucketId) { this.capRerouteBucketId = capRerouteBucketId; }

    public Instant getLastContributionDate() { return lastContributionDate; }
    public void setLastContributionDate(Instant lastContributionDate) { this.lastContributionDate = lastContributionDate; }
}
