package com.reviewflow.service;

import java.util.UUID;

public record ReviewerWorkload(
        UUID reviewerId,
        long activeAssignments,
        long completedThisWeek,
        int missedReviews
) {
}
