package com.budgetbuckets.ledger.controller;

import com.budgetbuckets.ledger.controller.dto.IncomeRequestDto;
import com.budgetbuckets.ledger.controller.dto.IncomeResponseDto;
import com.budgetbuckets.ledger.model.Income;
import com.budgetbuckets.ledger.service.IncomeService;
import com.budgetbuckets.ledger.user.UserService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{userId}/income")
public class IncomeController {

    private final IncomeService incomeService;
    private final UserService userService;

    public IncomeController(IncomeService incomeService, UserService userService) {
        this.incomeService = incomeService;
        this.userService = userService;
    }

    @GetMapping
    public ResponseEntity<List<IncomeResponseDto>> listIncome(@PathVariable("userId") UUID userId) {
        userService.requireUser(userId);
        return ResponseEntity.ok(incomeService.listIncome(userId).stream().map(this::map).toList());
    }

    @PostMapping
    public ResponseEntity<IncomeResponseDto> addIncome(
            @PathVariable("userId") UUID userId,
            @RequestBody @Valid IncomeRequestDto request
    ) {
        userService.requireUser(userId);
        Income income = incomeService.addIncome(userId, request.amount(), request.date(), request.note(),
                request.recurringFlag());
        return ResponseEntity.status(HttpStatus.CREATED).body(map(income));
    }

    @DeleteMapping("/{incomeId}")
    public ResponseEntity<Void> deleteIncome(
            @PathVariable("userId") UUID userId,
            @PathVariable("incomeId") UUID incomeId
    ) {
        userService.requireUser(userId);
        incomeService.deleteIncome(userId, incomeId);
        return ResponseEntity.noContent().build();
    }

    private IncomeResponseDto map(Income income) {
        return new IncomeResponseDto(
                income.id().toString(),
                income.userId().toString(),
                income.amount(),
                income.date(),
                income.note(),
                income.recurring(),
                income.createdAt()
        );
    }
}
