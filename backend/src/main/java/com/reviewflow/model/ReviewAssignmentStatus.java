package com.reviewflow.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one reviewer's obligation on one submission.
 * COMPLETED and REASSIGNED are terminal; MISSED may move to REASSIGNED once.
 */
public enum ReviewAssignmentStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    MISSED,
    REASSIGNED;

    public static final Set<ReviewAssignmentStatus> ACTIVE_STATUSES = EnumSet.of(PENDING, IN_PROGRESS);
    public static final Set<ReviewAssignmentStatus> NON_TERMINAL_STATUSES = EnumSet.of(PENDING, IN_PROGRESS, MISSED);

    public boolean isActive() {
        return ACTIVE_STATUSES.contains(this);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REASSIGNED;
    }

    public boolean canTransitionTo(ReviewAssignmentStatus target) {
        return switch (this) {
            case PENDING -> target == IN_PROGRESS || target == COMPLETED || target == MISSED;
            case IN_PROGRESS -> target == COMPLETED || target == MISSED;
            case MISSED -> target == REASSIGNED;
            case COMPLETED, REASSIGNED -> false;
        };
    }
}
