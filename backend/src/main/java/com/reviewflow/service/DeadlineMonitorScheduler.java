package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class DeadlineMonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeadlineMonitorScheduler.class);

    private final ReviewflowProperties reviewflowProperties;
    private final DeadlineMonitorService deadlineMonitorService;

    private final AtomicReference<DeadlineMonitorResult> lastResult = new AtomicReference<>();

    @PostConstruct
    void validateCadence() {
        reviewflowProperties.validateSweepCadence();
    }

    @Scheduled(
            fixedRateString = "${reviewflow.deadline.sweep-interval-ms:1800000}",
            initialDelayString = "${reviewflow.deadline.initial-delay-ms:60000}"
    )
    public void processDeadlineTick() {
        if (!reviewflowProperties.getDeadline().isSweepEnabled()) {
            return;
        }
        runSweep();
    }

    /**
     * Runs one sweep immediately, regardless of the enabled flag. Used by the manual trigger endpoint.
     */
    public DeadlineMonitorResult runSweep() {
        DeadlineMonitorResult result = deadlineMonitorService.processDeadlines();
        lastResult.set(result);

        if (result.hasErrors()) {
            log.warn(
                    "Deadline sweep finished with {} error(s): processed={}, reminders={}, penalties={}, reassignments={}",
                    result.errors().size(),
                    result.processed(),
                    result.reminders(),
                    result.penalties(),
                    result.reassignments()
            );
        } else if (result.hasWork()) {
            log.info(
                    "Deadline sweep: processed={}, reminders={}, penalties={}, reassignments={}",
                    result.processed(),
                    result.reminders(),
                    result.penalties(),
                    result.reassignments()
            );
        } else {
            log.debug("Deadline sweep completed with no state changes (processed={})", result.processed());
        }
        return result;
    }

    public Optional<DeadlineMonitorResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }
}
