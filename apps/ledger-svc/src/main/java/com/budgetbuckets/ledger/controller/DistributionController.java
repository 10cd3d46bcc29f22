package com.budgetbuckets.ledger.controller;

import com.budgetbuckets.ledger.allocation.DistributionResult;
import com.budgetbuckets.ledger.allocation.DistributionService;
import com.budgetbuckets.ledger.allocation.DistributionStatus;
import com.budgetbuckets.ledger.user.UserService;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{userId}/distribution")
public class DistributionController {

    private final DistributionService distributionService;
    private final UserService userService;

    public DistributionController(DistributionService distributionService, UserService userService) {
        this.distributionService = distributionService;
        this.userService = userService;
    }

    @PostMapping
    public ResponseEntity<DistributionResult> calculateDistribution(@PathVariable("userId") UUID userId) {
        userService.requireUser(userId);
        return ResponseEntity.ok(distributionService.calculateDistribution(userId));
    }

    @GetMapping
    public ResponseEntity<DistributionStatus> getDistributionStatus(@PathVariable("userId") UUID userId) {
        userService.requireUser(userId);
        return ResponseEntity.ok(distributionService.getDistributionStatus(userId));
    }
}
