package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.RolloverEntryEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaRolloverEntryRepository extends JpaRepository<RolloverEntryEntity, UUID> {

    @Query("SELECT r FROM RolloverEntryEntity r WHERE r.userId = :userId ORDER BY r.rolloverDate DESC, r.bucketName ASC")
    List<RolloverEntryEntity> findByUserId(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RolloverEntryEntity r WHERE r.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
