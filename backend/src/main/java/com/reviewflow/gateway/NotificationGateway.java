package com.reviewflow.gateway;

import com.reviewflow.model.ReviewAssignment;

import java.util.UUID;

public interface NotificationGateway {

    boolean hasDeadlineReminder(UUID reviewerId, UUID assignmentId, int reminderIntervalHours);

    /**
     * Writes the reminder unless one already exists for (reviewer, assignment, interval).
     * The stored row is the dedupe record for later sweeps.
     *
     * @return true when a new reminder was written
     */
    boolean createDeadlineReminderIfAbsent(ReviewAssignment assignment, int reminderIntervalHours);

    void notifyReviewAssigned(UUID reviewerId, UUID submissionId, UUID assignmentId);

    void notifyReviewReassigned(UUID previousReviewerId, UUID submissionId, UUID assignmentId);
}
