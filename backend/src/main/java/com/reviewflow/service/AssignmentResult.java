package com.reviewflow.service;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of an assignment attempt. Business failures live in {@code errors};
 * degraded side effects after a durable write live in {@code warnings}.
 */
public record AssignmentResult(
        boolean success,
        List<ReviewerCandidate> assignedReviewers,
        List<UUID> assignmentIds,
        List<String> errors,
        List<String> warnings
) {

    public AssignmentResult {
        assignedReviewers = List.copyOf(assignedReviewers);
        assignmentIds = List.copyOf(assignmentIds);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static AssignmentResult failed(List<String> errors, List<String> warnings) {
        return new AssignmentResult(false, List.of(), List.of(), errors, warnings);
    }
}
