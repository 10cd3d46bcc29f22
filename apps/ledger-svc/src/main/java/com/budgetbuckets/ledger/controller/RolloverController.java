package com.budgetbuckets.ledger.controller;

import com.budgetbuckets.ledger.model.RolloverEntry;
import com.budgetbuckets.ledger.rollover.RolloverCheckResult;
import com.budgetbuckets.ledger.rollover.RolloverReport;
import com.budgetbuckets.ledger.rollover.RolloverService;
import com.budgetbuckets.ledger.rollover.ScheduledRolloverJob;
import com.budgetbuckets.ledger.rollover.ScheduledRolloverSummary;
import com.budgetbuckets.ledger.user.UserService;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RolloverController {

    private final RolloverService rolloverService;
    private final ScheduledRolloverJob scheduledRolloverJob;
    private final UserService userService;

    public RolloverController(
            RolloverService rolloverService,
            ScheduledRolloverJob scheduledRolloverJob,
            UserService userService
    ) {
        this.rolloverService = rolloverService;
        this.scheduledRolloverJob = scheduledRolloverJob;
        this.userService = userService;
    }

    @PostMapping("/users/{userId}/rollovers")
    public ResponseEntity<RolloverReport> manualRollover(@PathVariable("userId") UUID userId) {
        userService.requireUser(userId);
        return ResponseEntity.ok(rolloverService.manualRollover(userId));
    }

    @PostMapping("/users/{userId}/rollovers/check")
    public ResponseEntity<RolloverCheckResult> checkAndPerformRollover(@PathVariable("userId") UUID userId) {
        userService.requireUser(userId);
        return ResponseEntity.ok(rolloverService.checkAndPerformRollover(userId));
    }

    @GetMapping("/users/{userId}/rollovers")
    public ResponseEntity<List<RolloverEntry>> rolloverHistory(@PathVariable("userId") UUID userId) {
        userService.requireUser(userId);
        return ResponseEntity.ok(rolloverService.getHistory(userId));
    }

    /**
     * Runs the scheduled batch on demand, for operators catching up after downtime.
     */
    @PostMapping("/rollovers/runs")
    public ResponseEntity<ScheduledRolloverSummary> runScheduledRollover() {
        return ResponseEntity.ok(scheduledRolloverJob.runScheduledRollover());
    }
}
