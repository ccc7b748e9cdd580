package com.reviewflow.config;

import com.reviewflow.service.DeadlineMonitorResult;
import com.reviewflow.service.DeadlineMonitorScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the outcome of the most recent deadline sweep. A sweep that collected
 * errors still reports UP; only a failed assignment load reports DOWN.
 */
@Component
public class DeadlineMonitorHealthIndicator implements HealthIndicator {

    private final DeadlineMonitorScheduler deadlineMonitorScheduler;
    private final ReviewflowProperties reviewflowProperties;

    public DeadlineMonitorHealthIndicator(DeadlineMonitorScheduler deadlineMonitorScheduler,
                                          ReviewflowProperties reviewflowProperties) {
        this.deadlineMonitorScheduler = deadlineMonitorScheduler;
        this.reviewflowProperties = reviewflowProperties;
    }

    @Override
    public Health health() {
        boolean sweepEnabled = reviewflowProperties.getDeadline().isSweepEnabled();
        DeadlineMonitorResult last = deadlineMonitorScheduler.lastResult().orElse(null);
        if (last == null) {
            return Health.unknown()
                    .withDetail("sweepEnabled", sweepEnabled)
                    .withDetail("lastSweep", "never")
                    .build();
        }

        boolean loadFailed = last.processed() == 0 && last.hasErrors();
        Health.Builder builder = loadFailed ? Health.down() : Health.up();
        builder.withDetail("sweepEnabled", sweepEnabled)
                .withDetail("lastSweepStartedAt", last.startedAt().toString())
                .withDetail("processed", last.processed())
                .withDetail("reminders", last.reminders())
                .withDetail("penalties", last.penalties())
                .withDetail("reassignments", last.reassignments())
                .withDetail("errors", last.errors().size());
        if (last.hasErrors()) {
            builder.withDetail("firstError", last.errors().get(0));
        }
        return builder.build();
    }
}
