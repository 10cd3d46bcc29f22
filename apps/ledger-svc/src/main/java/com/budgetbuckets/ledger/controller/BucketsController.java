package com.budgetbuckets.ledger.controller;

import com.budgetbuckets.ledger.controller.dto.BalanceAdjustmentRequestDto;
import com.budgetbuckets.ledger.controller.dto.BucketRequestDto;
import com.budgetbuckets.ledger.controller.dto.BucketResponseDto;
import com.budgetbuckets.ledger.controller.dto.LegacyMigrationRequestDto;
import com.budgetbuckets.ledger.controller.dto.LegacyMigrationResponseDto;
import com.budgetbuckets.ledger.model.Bucket;
import com.budgetbuckets.ledger.model.FundedPlan;
import com.budgetbuckets.ledger.model.SavePlan;
import com.budgetbuckets.ledger.service.BucketDraft;
import com.budgetbuckets.ledger.service.BucketService;
import com.budgetbuckets.ledger.service.BucketView;
import com.budgetbuckets.ledger.service.LegacyBucketMigrationService;
import com.budgetbuckets.ledger.service.LegacyBucketRow;
import com.budgetbuckets.ledger.user.UserService;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{userId}/buckets")
public class BucketsController {

    private final BucketService bucketService;
    private final LegacyBucketMigrationService legacyBucketMigrationService;
    private final UserService userService;

    public BucketsController(
            BucketService bucketService,
            LegacyBucketMigrationService legacyBucketMigrationService,
            UserService userService
    ) {
        this.bucketService = bucketService;
        this.legacyBucketMigrationService = legacyBucketMigrationService;
        this.userService = userService;
    }

    @GetMapping
    public ResponseEntity<List<BucketResponseDto>> listBuckets(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "month", required = false) String month
    ) {
        userService.requireUser(userId);
        YearMonth focusMonth = parseMonth(month);
        return ResponseEntity.ok(bucketService.listBuckets(userId, focusMonth).stream().map(this::map).toList());
    }

    @PostMapping
    public ResponseEntity<BucketResponseDto> createBucket(
            @PathVariable("userId") UUID userId,
            @RequestBody @Valid BucketRequestDto request
    ) {
        userService.requireUser(userId);
        Bucket created = bucketService.createBucket(userId, toDraft(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(map(bucketService.getBucket(userId, created.id())));
    }

    @GetMapping("/{bucketId}")
    public ResponseEntity<BucketResponseDto> getBucket(
            @PathVariable("userId") UUID userId,
            @PathVariable("bucketId") UUID bucketId
    ) {
        userService.requireUser(userId);
        return ResponseEntity.ok(map(bucketService.getBucket(userId, bucketId)));
    }

    @PutMapping("/{bucketId}")
    public ResponseEntity<BucketResponseDto> updateBucket(
            @PathVariable("userId") UUID userId,
            @PathVariable("bucketId") UUID bucketId,
            @RequestBody @Valid BucketRequestDto request
    ) {
        userService.requireUser(userId);
        bucketService.updateBucket(userId, bucketId, toDraft(request));
        return ResponseEntity.ok(map(bucketService.getBucket(userId, bucketId)));
    }

    @DeleteMapping("/{bucketId}")
    public ResponseEntity<Void> removeBucket(
            @PathVariable("userId") UUID userId,
            @PathVariable("bucketId") UUID bucketId
    ) {
        userService.requireUser(userId);
        bucketService.removeBucket(userId, bucketId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{bucketId}/balance-adjustments")
    public ResponseEntity<BucketResponseDto> adjustBalance(
            @PathVariable("userId") UUID userId,
            @PathVariable("bucketId") UUID bucketId,
            @RequestBody @Valid BalanceAdjustmentRequestDto request
    ) {
        userService.requireUser(userId);
        bucketService.adjustBalance(userId, bucketId, request.amount());
        return ResponseEntity.ok(map(bucketService.getBucket(userId, bucketId)));
    }

    @PostMapping("/legacy-migrations")
    public ResponseEntity<LegacyMigrationResponseDto> migrateLegacyBuckets(
            @PathVariable("userId") UUID userId,
            @RequestBody @Valid LegacyMigrationRequestDto request
    ) {
        userService.requireUser(userId);
        List<LegacyBucketRow> rows = request.buckets().stream()
                .map(row -> new LegacyBucketRow(row.name(), row.allocationType(), row.allocationValue(),
                        row.currentBalance(), row.color(), row.icon(), row.alertThreshold()))
                .toList();
        var result = legacyBucketMigrationService.migrateLegacyBuckets(userId, rows);
        return ResponseEntity.status(HttpStatus.CREATED).body(new LegacyMigrationResponseDto(
                result.migrated(),
                result.bucketIds().stream().map(UUID::toString).toList()
        ));
    }

    static YearMonth parseMonth(String month) {
        if (month == null || month.isBlank()) {
            return null;
        }
        try {
            return YearMonth.parse(month);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("month must be formatted as YYYY-MM");
        }
    }

    private BucketDraft toDraft(BucketRequestDto request) {
        return new BucketDraft(
                request.name(),
                request.mode(),
                request.allocationType(),
                request.allocationValue(),
                request.targetAmount(),
                request.contributionType(),
                request.contributionValue(),
                request.capBehavior(),
                request.capRerouteBucketId(),
                request.alertThreshold(),
                request.color(),
                request.icon()
        );
    }

    private BucketResponseDto map(BucketView view) {
        Bucket bucket = view.bucket();
        FundedPlan funded = bucket.plan() instanceof FundedPlan plan ? plan : null;
        SavePlan save = bucket.plan() instanceof SavePlan plan ? plan : null;
        BigDecimal allocationValue = funded != null ? funded.allocation().value() : null;
        return new BucketResponseDto(
                bucket.id().toString(),
                bucket.userId().toString(),
                bucket.name(),
                bucket.mode(),
                bucket.color(),
                bucket.icon(),
                bucket.alertThreshold(),
                bucket.active(),
                bucket.createdAt(),
                bucket.lastRolloverDate(),
                funded != null ? funded.allocation().type() : null,
                allocationValue,
                funded != null ? funded.fundedAmount() : null,
                funded != null ? funded.carryoverBalance() : null,
                save != null ? save.targetAmount() : null,
                save != null ? save.currentBalance() : null,
                save != null ? save.contribution().type() : null,
                save != null ? save.contribution().value() : null,
                save != null ? save.capBehavior() : null,
                save != null && save.capRerouteBucketId() != null ? save.capRerouteBucketId().toString() : null,
                save != null ? save.lastContributionDate() : null,
                view.spentAmount(),
                view.availableAmount()
        );
    }
}
