package com.budgetbuckets.ledger.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    Clock ledgerClock(BudgetBucketsProperties properties) {
        Clock clock = Clock.system(properties.rollover().zoneId());
        log.info("Ledger clock running in zone {}", clock.getZone());
        return clock;
    }
}
