package com.budgetbuckets.ledger.repository;

import com.budgetbuckets.ledger.entity.RolloverEntryEntity;
import com.budgetbuckets.ledger.model.RolloverEntry;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLRolloverHistoryRepository implements RolloverHistoryRepository {

    private final JpaRolloverEntryRepository jpaRolloverEntryRepository;

    public PostgreSQLRolloverHistoryRepository(JpaRolloverEntryRepository jpaRolloverEntryRepository) {
        this.jpaRolloverEntryRepository = jpaRolloverEntryRepository;
    }

    @Override
    public List<RolloverEntry> saveAll(List<RolloverEntry> entries) {
        List<RolloverEntryEntity> entities = entries.stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
        return jpaRolloverEntryRepository.saveAll(entities).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public List<RolloverEntry> findByUserId(UUID userId) {
        return jpaRolloverEntryRepository.findByUserId(userId).stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByUserId(UUID userId) {
        return jpaRolloverEntryRepository.deleteByUserId(userId);
    }

    private RolloverEntryEntity toEntity(RolloverEntry entry) {
        RolloverEntryEntity entity = new RolloverEntryEntity();
        entity.setId(entry.id());
        entity.setUserId(entry.userId());
        entity.setBucketId(entry.bucketId());
        entity.setBucketName(entry.bucketName());
        entity.setMode(entry.mode());
        entity.setRolloverDate(entry.rolloverDate());
        entity.setOpeningAmount(entry.openingAmount());
        entity.setFundedAmount(entry.fundedAmount());
        entity.setMovedAmount(entry.movedAmount());
        entity.setClosingAmount(entry.closingAmount());
        entity.setNewFundedAmount(entry.newFundedAmount());
        entity.setMessage(entry.message());
        return entity;
    }

    private RolloverEntry toModel(RolloverEntryEntity entity) {
        return new RolloverEntry(
                entity.getId(),
                entity.getUserId(),
                entity.getBucketId(),
                entity.getBucketName(),
                entity.getMode(),
                entity.getRolloverDate(),
                entity.getOpeningAmount(),
                entity.getFundedAmount(),
                entity.getMovedAmount(),
                entity.getClosingAmount(),
                entity.getNewFundedAmount(),
                entity.getMessage()
        );
    }
}
