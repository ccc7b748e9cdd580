package com.reviewflow.controller.dto;

import java.util.UUID;

public final class ReviewAssignmentResponses {

    private ReviewAssignmentResponses() {
    }

    public record ExtendDeadlineResponse(
            UUID assignmentId,
            boolean extended
    ) {
    }
}
