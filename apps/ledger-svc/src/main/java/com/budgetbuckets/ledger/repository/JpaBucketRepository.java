package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.BucketEntity;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaBucketRepository extends JpaRepository<BucketEntity, UUID> {

    @Query("SELECT b FROM BucketEntity b WHERE b.userId = :userId AND b.active = true ORDER BY b.createdAt ASC, b.id ASC")
    List<BucketEntity> findActiveByUserId(@Param("userId") UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BucketEntity b WHERE b.userId = :userId AND b.active = true ORDER BY b.createdAt ASC, b.id ASC")
    List<BucketEntity> lockActiveByUserId(@Param("userId") UUID userId);

    @Query("SELECT b FROM BucketEntity b WHERE b.userId = :userId ORDER BY b.createdAt ASC, b.id ASC")
    List<BucketEntity> findByUserId(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM BucketEntity b WHERE b.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
