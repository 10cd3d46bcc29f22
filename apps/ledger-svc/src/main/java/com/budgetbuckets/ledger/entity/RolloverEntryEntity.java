package com.budgetbuckets.ledger.entity;

import com.budgetbuckets.ledger.model.BucketMode;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "rollover_entries", indexes = @Index(name = "idx_rollover_entries_user", columnList = "user_id, rollover_date"))
public class RolloverEntryEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "bucket_id", nullable = false)
    private UUID bucketId;

    @Column(name = "bucket_name", nullable = false)
    private String bucketName;

    @Enumerated(EnumType.STRING)
    @Column(name = "bucket_mode", nullable = false, length = 16)
    private BucketMode mode;

    @Column(name = "rollover_date", nullable = false)
    private Instant rolloverDate;

    @Column(name = "opening_amount", precision = 14, scale = 2)
    private BigDecimal openingAmount;

    @Column(name = "funded_amount", precision = 14, scale = 2)
    private BigDecimal fundedAmount;

    @Column(name = "moved_amount", precision = 14, scale = 2)
    private BigDecimal movedAmount;

    @Column(name = "closing_amount", precision = 14, scale = 2)
    private BigDecimal closingAmount;

    @Column(name = "new_funded_amount", precision = 14, scale = 2)
    private BigDecimal newFundedAmount;

    @Column(name = "message", length = 512)
    private String message;

    // Default constructor for JPA
    public RolloverEntryEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public UUID getBucketId() { return bucketId; }
    public void setBucketId(UUID bucketId) { this.bucketId = bucketId; }

    public String getBucketName() { return bucketName; }
    public void setBucketName(String bucketName) { this.bucketName = bucketName; }

    public BucketMode getMode() { return mode; }
    public void setMode(BucketMode mode) { this.mode = mode; }

    public Instant getRolloverDate() { return rolloverDate; }
    public void setRolloverDate(Instant rolloverDate) { this.rolloverDate = rolloverDate; }

    public BigDecimal getOpeningAmount() { return openingAmount; }
    public void setOpeningAmount(BigDecimal openingAmount) { this.openingAmount = openingAmount; }

    public BigDecimal getFundedAmount() { return fundedAmount; }
    public void setFundedAmount(BigDecimal fundedAmount) { this.fundedAmount = fundedAmount; }

    public BigDecimal getMovedAmount() { return movedAmount; }
    public void setMovedAmount(BigDecimal movedAmount) { this.movedAmount = movedAmount; }

    public BigDecimal getClosingAmount() { return closingAmount; }
    public void setClosingAmount(BigDecimal closingAmount) { this.closingAmount = closingAmount; }

    public BigDecimal getNewFundedAmount() { return newFundedAmount; }
    public void setNewFundedAmount(BigDecimal newFundedAmount) { this.newFundedAmount = newFundedAmount; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
