package com.budgetbuckets.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "income", indexes = @Index(name = "idx_income_user", columnList = "user_id"))
public class IncomeEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "income_date", nullable = false)
    private Instant date;

    @Column(name = "note")
    private String note;

    @Column(name = "recurring", nullable = false)
    private boolean recurring;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public IncomeEntity() {}

    public IncomeEntity(UUID id, UUID userId, BigDecimal amount, Instant date, String note,
                        boolean recurring, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.amount = amount;
        this.date = date;
        this.note = note;
        this.recurring = recurring;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public Instant getDate() { return date; }
    public void setDate(Instant date) { this.date = date; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }

    public boolean isRecurring() { return recurring; }
    public void setRecurring(boolean recurring) { this.recurring = recurring; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
