package com.reviewflow.service;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Aggregate counts of one deadline sweep. Per-assignment failures are collected in {@code errors}.
 */
public record DeadlineMonitorResult(
        OffsetDateTime startedAt,
        int processed,
        int reminders,
        int reassignments,
        int penalties,
        List<String> errors
) {

    public DeadlineMonitorResult {
        errors = List.copyOf(errors);
    }

    public boolean hasWork() {
        return reminders > 0 || reassignments > 0 || penalties > 0;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
