package com.budgetbuckets.ledger.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.scheduling.support.CronExpression;

@ConfigurationProperties(prefix = "budgetbuckets")
public record BudgetBucketsProperties(Rollover rollover) {

    public static final String DEFAULT_ROLLOVER_CRON = "0 1 0 1 * *";
    public static final String DEFAULT_ROLLOVER_ZONE = "UTC";

    @ConstructorBinding
    public BudgetBucketsProperties {
        if (rollover == null) {
            rollover = new Rollover(null, null, null);
        }
    }

    /**
     * Monthly rollover trigger. The cron fires in {@code zone}; the same zone decides
     * which calendar month a rollover or contribution belongs to.
     */
    public record Rollover(Boolean enabled, String cron, String zone) {
        public Rollover {
            if (cron == null || cron.isBlank()) {
                cron = DEFAULT_ROLLOVER_CRON;
            }
            if (!CronExpression.isValidExpression(cron)) {
                throw new IllegalArgumentException("rollover cron is not a valid cron expression: " + cron);
            }
            if (zone == null || zone.isBlank()) {
                zone = DEFAULT_ROLLOVER_ZONE;
            }
            try {
                ZoneId.of(zone);
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException("rollover zone is not a valid zone id: " + zone, ex);
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }
}
