package com.budgetbuckets.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "expenses", indexes = {
        @Index(name = "idx_expenses_user", columnList = "user_id"),
        @Index(name = "idx_expenses_bucket_date", columnList = "bucket_id, expense_date"),
        @Index(name = "idx_expenses_bucket_booked", columnList = "bucket_id, booked_at")
})
public class ExpenseEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "bucket_id", nullable = false)
    private UUID bucketId;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "expense_date", nullable = false)
    private Instant date;

    @Column(name = "booked_at", nullable = false)
    private Instant bookedAt;

    @Column(name = "note")
    private String note;

    @Column(name = "auto_generated", nullable = false)
    private boolean autoGenerated;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Default constructor for JPA
    public ExpenseEntity() {}

    public ExpenseEntity(UUID id, UUID userId, UUID bucketId, BigDecimal amount, Instant date, Instant bookedAt,
                         String note, boolean autoGenerated, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.userId = userId;
        this.bucketId = bucketId;
        this.amount = amount;
        this.date = date;
        this.bookedAt = bookedAt;
        this.note = note;
        this.autoGenerated = autoGenerated;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public UUID getBucketId() { return bucketId; }
    public void setBucketId(UUID bucketId) { this.bucketId = bucketId; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public Instant getDate() { return date; }
    public void setDate(Instant date) { this.date = date; }

    public Instant getBookedAt() { return bookedAt; }
    public void setBookedAt(Instant bookedAt) { this.bookedAt = bookedAt; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }

    public boolean isAutoGenerated() { return autoGenerated; }
    public void setAutoGenerated(boolean autoGenerated) { this.autoGenerated = autoGenerated; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
