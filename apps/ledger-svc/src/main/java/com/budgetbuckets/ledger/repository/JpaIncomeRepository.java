package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.IncomeEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaIncomeRepository extends JpaRepository<IncomeEntity, UUID> {

    @Query("SELECT i FROM IncomeEntity i WHERE i.userId = :userId ORDER BY i.date DESC")
    List<IncomeEntity> findByUserId(@Param("userId") UUID userId);

    @Query("SELECT i FROM IncomeEntity i WHERE i.userId = :userId AND i.recurring = true ORDER BY i.date DESC")
    List<IncomeEntity> findRecurringByUserId(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM IncomeEntity i WHERE i.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
