package com.reviewflow.service;

import com.reviewflow.model.ReviewAssignmentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DeadlineStatus(
        UUID assignmentId,
        UUID submissionId,
        UUID reviewerId,
        ReviewAssignmentStatus status,
        OffsetDateTime deadline,
        DeadlineUrgency urgency,
        double hoursRemaining
) {
}
