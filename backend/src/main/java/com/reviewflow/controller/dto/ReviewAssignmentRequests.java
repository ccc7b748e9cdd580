package com.reviewflow.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Set;
import java.util.UUID;

public final class ReviewAssignmentRequests {

    private ReviewAssignmentRequests() {
    }

    public record AutoAssignRequest(
            @NotNull(message = "submissionId is required")
            UUID submissionId,

            @NotNull(message = "authorUserId is required")
            UUID authorUserId,

            @Min(value = 1, message = "minimumReviewers must be at least 1")
            Integer minimumReviewers,

            @Min(value = 1, message = "maxActiveAssignments must be at least 1")
            Integer maxActiveAssignments,

            Set<UUID> excludeUserIds,

            Set<String> taskTypes,

            boolean allowPartialAssignment
    ) {
    }

    public record ManualAssignRequest(
            @NotNull(message = "submissionId is required")
            UUID submissionId,

            @NotEmpty(message = "reviewerIds must not be empty")
            @Size(max = 5, message = "reviewerIds supports at most 5 reviewers")
            List<@NotNull(message = "reviewerIds must not contain null") UUID> reviewerIds
    ) {
    }

    public record ExtendDeadlineRequest(
            @NotNull(message = "additionalHours is required")
            @DecimalMin(value = "0.0", inclusive = false, message = "additionalHours must be positive")
            Double additionalHours,

            @Size(max = 500, message = "reason must be at most 500 characters")
            String reason
    ) {
    }

    public record ReshuffleRequest(
            @Size(max = 120, message = "reason must be at most 120 characters")
            String reason,

            boolean dryRun
    ) {
    }
}
