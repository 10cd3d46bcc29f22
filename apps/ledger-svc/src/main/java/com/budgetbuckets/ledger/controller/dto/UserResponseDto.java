package com.budgetbuckets.ledger.controller.dto;

import java.time.Instant;

public record UserResponseDto(String id, String name, Instant createdAt) {
}
