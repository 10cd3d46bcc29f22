package com.budgetbuckets.ledger.controller.dto;

import java.util.List;

public record LegacyMigrationResponseDto(int migrated, List<String> bucketIds) {
}
