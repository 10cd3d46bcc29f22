package com.budgetbuckets.ledger.health;

import com.budgetbuckets.ledger.config.BudgetBucketsProperties;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight liveness endpoint for external checks. Also reports whether the monthly
 * rollover scheduler is switched on. Actuator stays the internal view.
 */
@RestController
public class HealthzController {

    private final BudgetBucketsProperties properties;

    public HealthzController(BudgetBucketsProperties properties) {
        this.properties = properties;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        BudgetBucketsProperties.Rollover rollover = properties.rollover();
        return Map.of(
                "status", "UP",
                "rolloverScheduler", rollover.enabledFlag() ? "ENABLED" : "DISABLED",
                "rolloverZone", rollover.zoneId().getId()
        );
    }
}
