package com.reviewflow.service;

import com.reviewflow.model.UserRole;

import java.util.UUID;

public record ReviewerCandidate(
        UUID id,
        String username,
        UserRole role,
        int totalXp,
        int missedReviews,
        int activeAssignmentCount
) {
}
