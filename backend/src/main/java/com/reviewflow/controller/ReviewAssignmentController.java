package com.reviewflow.controller;

import com.reviewflow.controller.dto.ReviewAssignmentRequests;
import com.reviewflow.controller.dto.ReviewAssignmentResponses;
import com.reviewflow.service.AssignmentResult;
import com.reviewflow.service.DeadlineMonitorService;
import com.reviewflow.service.DeadlineStatus;
import com.reviewflow.service.EligibilityCheck;
import com.reviewflow.service.ReshuffleResult;
import com.reviewflow.service.ReviewReassignmentService;
import com.reviewflow.service.ReviewAssignmentService;
import com.reviewflow.service.ReviewerPoolOptions;
import com.reviewflow.service.ReviewerPoolService;
import com.reviewflow.service.ReviewerWorkload;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/assignments")
public class ReviewAssignmentController {

    private final ReviewAssignmentService reviewAssignmentService;
    private final ReviewerPoolService reviewerPoolService;
    private final DeadlineMonitorService deadlineMonitorService;
    private final ReviewReassignmentService reviewReassignmentService;

    public ReviewAssignmentController(ReviewAssignmentService reviewAssignmentService,
                                      ReviewerPoolService reviewerPoolService,
                                      DeadlineMonitorService deadlineMonitorService,
                                      ReviewReassignmentService reviewReassignmentService) {
        this.reviewAssignmentService = reviewAssignmentService;
        this.reviewerPoolService = reviewerPoolService;
        this.deadlineMonitorService = deadlineMonitorService;
        this.reviewReassignmentService = reviewReassignmentService;
    }

    @PostMapping("/auto")
    public ResponseEntity<AssignmentResult> assignAutomatically(
            @Valid @RequestBody ReviewAssignmentRequests.AutoAssignRequest request
    ) {
        ReviewerPoolOptions options = new ReviewerPoolOptions(
                request.maxActiveAssignments(),
                request.excludeUserIds(),
                request.taskTypes(),
                request.minimumReviewers(),
                request.allowPartialAssignment()
        );
        AssignmentResult result = reviewAssignmentService.assignReviewers(
                request.submissionId(),
                request.authorUserId(),
                options
        );
        return toResponse(result);
    }

    @PostMapping("/manual")
    public ResponseEntity<AssignmentResult> assignManually(
            @Valid @RequestBody ReviewAssignmentRequests.ManualAssignRequest request
    ) {
        AssignmentResult result = reviewAssignmentService.assignSpecificReviewers(
                request.submissionId(),
                request.reviewerIds()
        );
        if (!result.success() && result.errors().contains(ReviewAssignmentService.SUBMISSION_NOT_FOUND)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Submission not found: " + request.submissionId());
        }
        return toResponse(result);
    }

    @GetMapping("/deadlines")
    public ResponseEntity<List<DeadlineStatus>> getDeadlineStatuses() {
        return ResponseEntity.ok(deadlineMonitorService.getDeadlineStatuses());
    }

    @GetMapping("/urgent")
    public ResponseEntity<List<DeadlineStatus>> getUrgentAssignments() {
        return ResponseEntity.ok(deadlineMonitorService.getUrgentAssignments());
    }

    @PostMapping("/{assignmentId}/extend")
    public ResponseEntity<ReviewAssignmentResponses.ExtendDeadlineResponse> extendDeadline(
            @PathVariable UUID assignmentId,
            @Valid @RequestBody ReviewAssignmentRequests.ExtendDeadlineRequest request
    ) {
        boolean extended = deadlineMonitorService.extendDeadline(
                assignmentId,
                request.additionalHours(),
                request.reason()
        );
        ReviewAssignmentResponses.ExtendDeadlineResponse body =
                new ReviewAssignmentResponses.ExtendDeadlineResponse(assignmentId, extended);
        return extended
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @PostMapping("/{assignmentId}/reshuffle")
    public ResponseEntity<ReshuffleResult> reshuffle(
            @PathVariable UUID assignmentId,
            @Valid @RequestBody(required = false) ReviewAssignmentRequests.ReshuffleRequest request
    ) {
        ReshuffleResult result = reviewReassignmentService.reshuffle(
                assignmentId,
                request != null ? request.reason() : null,
                request != null && request.dryRun()
        );
        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = switch (result.reason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_PROCESSED, NO_REPLACEMENT_AVAILABLE -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/reviewers/{reviewerId}/workload")
    public ResponseEntity<ReviewerWorkload> getReviewerWorkload(@PathVariable UUID reviewerId) {
        return ResponseEntity.ok(reviewerPoolService.getReviewerWorkload(reviewerId));
    }

    @GetMapping("/reviewers/{reviewerId}/eligibility")
    public ResponseEntity<EligibilityCheck> checkEligibility(
            @PathVariable UUID reviewerId,
            @RequestParam UUID submissionId
    ) {
        EligibilityCheck check = reviewAssignmentService.checkReviewerEligibility(reviewerId, submissionId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Submission not found: " + submissionId
                ));
        return ResponseEntity.ok(check);
    }

    private static ResponseEntity<AssignmentResult> toResponse(AssignmentResult result) {
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }
}
