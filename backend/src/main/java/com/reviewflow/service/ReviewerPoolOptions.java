package com.reviewflow.service;

import java.util.Set;
import java.util.UUID;

/**
 * Per-call overrides for reviewer selection. Null numeric fields fall back to the configured policy.
 */
public record ReviewerPoolOptions(
        Integer maxActiveAssignments,
        Set<UUID> excludeUserIds,
        Set<String> taskTypes,
        Integer minimumReviewers,
        boolean allowPartialAssignment
) {

    public ReviewerPoolOptions {
        excludeUserIds = excludeUserIds == null ? Set.of() : Set.copyOf(excludeUserIds);
        taskTypes = taskTypes == null ? Set.of() : Set.copyOf(taskTypes);
    }

    public static ReviewerPoolOptions defaults() {
        return new ReviewerPoolOptions(null, Set.of(), Set.of(), null, false);
    }

    /**
     * Options for finding a single replacement for a reviewer who missed the deadline.
     */
    public static ReviewerPoolOptions replacementFor(UUID missingReviewerId, Set<String> taskTypes) {
        return new ReviewerPoolOptions(null, Set.of(missingReviewerId), taskTypes, 1, false);
    }

    public ReviewerPoolOptions withAllowPartialAssignment(boolean allowPartial) {
        return new ReviewerPoolOptions(maxActiveAssignments, excludeUserIds, taskTypes, minimumReviewers, allowPartial);
    }

    public ReviewerPoolOptions withMinimumReviewers(Integer minimum) {
        return new ReviewerPoolOptions(maxActiveAssignments, excludeUserIds, taskTypes, minimum, allowPartialAssignment);
    }
}
