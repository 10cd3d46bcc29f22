package com.budgetbuckets.ledger.rollover;

import com.budgetbuckets.ledger.config.BudgetBucketsProperties;
import com.budgetbuckets.ledger.user.UserEntity;
import com.budgetbuckets.ledger.user.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ScheduledRolloverJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledRolloverJob.class);

    private final UserRepository userRepository;
    private final RolloverService rolloverService;
    private final BudgetBucketsProperties properties;
    private final Clock clock;

    public ScheduledRolloverJob(UserRepository userRepository,
                                RolloverService rolloverService,
                                BudgetBucketsProperties properties,
                                Clock clock) {
        this.userRepository = userRepository;
        this.rolloverService = rolloverService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${budgetbuckets.rollover.cron:0 1 0 1 * *}", zone = "${budgetbuckets.rollover.zone:UTC}")
    public void rolloverOnSchedule() {
        if (!properties.rollover().enabledFlag()) {
            log.debug("Scheduled rollover disabled; skipping run");
            return;
        }
        runScheduledRollover();
    }

    /**
     * Checks every user. One user's failure is logged and recorded; the others still run.
     */
    public ScheduledRolloverSummary runScheduledRollover() {
        Instant startedAt = clock.instant();
        List<UserEntity> users = userRepository.findAll();
        List<ScheduledRolloverSummary.UserOutcome> outcomes = new ArrayList<>(users.size());
        int succeeded = 0;
        int failed = 0;

        for (UserEntity user : users) {
            MDC.put("user_id", user.getId().toString());
            try {
                RolloverCheckResult result = rolloverService.checkAndPerformRollover(user.getId());
                outcomes.add(ScheduledRolloverSummary.UserOutcome.success(user.getId(), user.getName(), result));
                succeeded++;
            } catch (RuntimeException ex) {
                log.warn("Scheduled rollover failed for user {}: {}", user.getId(), ex.getMessage(), ex);
                outcomes.add(ScheduledRolloverSummary.UserOutcome.failure(user.getId(), user.getName(), ex.getMessage()));
                failed++;
            } finally {
                MDC.remove("user_id");
            }
        }

        log.info("Scheduled rollover finished: {} users, {} succeeded, {} failed", users.size(), succeeded, failed);
        return new ScheduledRolloverSummary(startedAt, users.size(), succeeded, failed, List.copyOf(outcomes));
    }
}
