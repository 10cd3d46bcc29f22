package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.BucketEntity;
import com.budgetbuckets.ledger.model.Allocation;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.BucketPlan;
import com.budgetbuckets.ledger.model.Contribution;
import com.budgetbuckets.ledger.model.FundedPlan;
import com.budgetbuckets.ledger.model.RecurringPlan;
import com.budgetbuckets.ledger.model.RolloverBasis;
import com.budgetbuckets.ledger.model.SavePlan;
import com.budgetbuckets.ledger.model.SpendPlan;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLBucketRepository implements BucketRepository {

    private final JpaBucketRepository jpaBucketRepository;

    public PostgreSQLBucketRepository(JpaBucketRepository jpaBucketRepository) {
        this.jpaBucketRepository = jpaBucketRepository;
    }

    @Override
    public Bucket save(Bucket bucket) {
        BucketEntity saved = jpaBucketRepository.save(toEntity(bucket));
        return toModel(saved);
    }

    @Override
    public Optional<Bucket> findById(UUID bucketId) {
        return jpaBucketRepository.findById(bucketId).map(this::toModel);
    }

    @Override
    public List<Bucket> findActiveByUserId(UUID userId) {
        return jpaBucketRepository.findActiveByUserId(userId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public List<Bucket> lockActiveByUserId(UUID userId) {
        return jpaBucketRepository.lockActiveByUserId(userId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public List<Bucket> findByUserId(UUID userId) {
        return jpaBucketRepository.findByUserId(userId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByUserId(UUID userId) {
        return jpaBucketRepository.deleteByUserId(userId);
    }

    private BucketEntity toEntity(Bucket bucket) {
        BucketEntity entity = new BucketEntity();
        entity.setId(bucket.id());
        entity.setUserId(bucket.userId());
        entity.setName(bucket.name());
        entity.setColor(bucket.color());
        entity.setIcon(bucket.icon());
        entity.setAlertThreshold(bucket.alertThreshold());
        entity.setActive(bucket.active());
        entity.setCreatedAt(bucket.createdAt());
        entity.setLastRolloverDate(bucket.lastRolloverDate());
        entity.setMode(bucket.mode());

        BucketPlan plan = bucket.plan();
        if (plan instanceof FundedPlan funded) {
            entity.setAllocationType(funded.allocation().type());
            entity.setAllocationValue(funded.allocation().value());
            entity.setFundedAmount(funded.fundedAmount());
            entity.setCarryoverBalance(funded.carryoverBalance());
            RolloverBasis basis = funded.rolloverBasis();
            if (basis != null) {
                entity.setBasisPreviousCarryover(basis.previousCarryover());
                entity.setBasisPreviousFunding(basis.previousFunding());
                entity.setBasisCycleStart(basis.cycleStart());
                entity.setBasisCycleEnd(basis.cycleEnd());
            }
        } else if (plan instanceof SavePlan save) {
            entity.setTargetAmount(save.targetAmount());
            entity.setCurrentBalance(save.currentBalance());
            entity.setContributionType(save.contribution().type());
            entity.setContributionValue(save.contribution().value());
            entity.setCapBehavior(save.capBehavior());
            entity.setCapRerouteBucketId(save.capRerouteBucketId());
            entity.setLastContributionDate(save.lastContributionDate());
        }
        return entity;
    }

    private Bucket toModel(BucketEntity entity) {
        return new Bucket(
                entity.getId(),
                entity.getUserId(),
                entity.getName(),
                entity.getColor(),
                entity.getIcon(),
                entity.getAlertThreshold(),
                entity.isActive(),
                entity.getCreatedAt(),
                entity.getLastRolloverDate(),
                toPlan(entity)
        );
    }

    private BucketPlan toPlan(BucketEntity entity) {
        return switch (entity.getMode()) {
            case SPEND -> new SpendPlan(
                    new Allocation(entity.getAllocationType(), entity.getAllocationValue()),
                    entity.getFundedAmount(),
                    entity.getCarryoverBalance(),
                    toBasis(entity));
            case RECURRING -> new RecurringPlan(
                    new Allocation(entity.getAllocationType(), entity.getAllocationValue()),
                    entity.getFundedAmount(),
                    entity.getCarryoverBalance(),
                    toBasis(entity));
            case SAVE -> new SavePlan(
                    entity.getTargetAmount(),
                    entity.getCurrentBalance(),
                    entity.getContributionType() == null
                            ? Contribution.none()
                            : new Contribution(entity.getContributionType(), entity.getContributionValue()),
                    entity.getCapBehavior(),
                    entity.getCapRerouteBucketId(),
                    entity.getLastContributionDate());
        };
    }

    private RolloverBasis toBasis(BucketEntity entity) {
        if (entity.getBasisCycleEnd() == null) {
            return null;
        }
        return new RolloverBasis(
                entity.getBasisPreviousCarryover(),
                entity.getBasisPreviousFunding(),
                entity.getBasisCycleStart(),
                entity.getBasisCycleEnd());
    }
}
