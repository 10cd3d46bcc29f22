package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.ExpenseEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaExpenseRepository extends JpaRepository<ExpenseEntity, UUID> {

    @Query("SELECT e FROM ExpenseEntity e WHERE e.userId = :userId ORDER BY e.date DESC")
    List<ExpenseEntity> findByUserId(@Param("userId") UUID userId);

    @Query("SELECT e FROM ExpenseEntity e WHERE e.bucketId = :bucketId ORDER BY e.date DESC")
    List<ExpenseEntity> findByBucketId(@Param("bucketId") UUID bucketId);

    @Query("SELECT e FROM ExpenseEntity e WHERE e.userId = :userId AND e.date >= :from AND e.date < :to ORDER BY e.date DESC")
    List<ExpenseEntity> findByUserIdAndRange(@Param("userId") UUID userId,
                                             @Param("from") Instant from,
                                             @Param("to") Instant to);

    @Query("""
            SELECT SUM(e.amount)
            FROM ExpenseEntity e
            WHERE e.bucketId = :bucketId AND e.date >= :from AND e.date < :to
            """)
    BigDecimal sumAmountByBucketIdAndRange(@Param("bucketId") UUID bucketId,
                                           @Param("from") Instant from,
                                           @Param("to") Instant to);

    @Query("""
            SELECT SUM(e.amount)
            FROM ExpenseEntity e
            WHERE e.bucketId = :bucketId AND e.bookedAt >= :from AND e.bookedAt < :to
            """)
    BigDecimal sumBookedAmountByBucketIdAndRange(@Param("bucketId") UUID bucketId,
                                                 @Param("from") Instant from,
                                                 @Param("to") Instant to);

    @Query("""
            SELECT COUNT(e)
            FROM ExpenseEntity e
            WHERE e.bucketId = :bucketId AND e.autoGenerated = true AND e.date >= :from AND e.date < :to
            """)
    long countAutoGeneratedByBucketIdAndRange(@Param("bucketId") UUID bucketId,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ExpenseEntity e WHERE e.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
