package com.reviewflow.service;

import com.reviewflow.model.ReviewAssignment;

import java.util.UUID;

/**
 * Outcome of an admin reshuffle. A dry run reports the candidate without writing anything;
 * {@code candidateReviewerId} is null when nobody could take the assignment over.
 */
public record ReshuffleResult(
        boolean success,
        boolean dryRun,
        ReviewAssignment releasedAssignment,
        ReviewAssignment newAssignment,
        UUID candidateReviewerId,
        ReshuffleFailureReason reason,
        String message
) {

    static ReshuffleResult reshuffled(ReviewAssignment released, ReviewAssignment replacement) {
        return new ReshuffleResult(true, false, released, replacement, replacement.getReviewerId(), null, null);
    }

    static ReshuffleResult preview(ReviewAssignment current, UUID candidateReviewerId) {
        return new ReshuffleResult(true, true, current, null, candidateReviewerId, null, null);
    }

    static ReshuffleResult failed(ReshuffleFailureReason reason, ReviewAssignment current, String message) {
        return new ReshuffleResult(false, false, current, null, null, reason, message);
    }
}
