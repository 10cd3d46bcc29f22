package com.budgetbuckets.ledger.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UserCreateRequestDto(
        @NotBlank @Size(max = 120) String name
) {
}
