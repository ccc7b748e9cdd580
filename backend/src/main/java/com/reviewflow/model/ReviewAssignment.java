package com.reviewflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "review_assignments")
public class ReviewAssignment {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "submission_id", nullable = false, updatable = false)
    private UUID submissionId;

    @Column(name = "reviewer_id", nullable = false, updatable = false)
    private UUID reviewerId;

    @Column(name = "deadline", nullable = false)
    private OffsetDateTime deadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReviewAssignmentStatus status = ReviewAssignmentStatus.PENDING;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private OffsetDateTime assignedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "released_at")
    private OffsetDateTime releasedAt;

    @Column(name = "release_reason", length = 128)
    private String releaseReason;

    @Column(name = "replacement_assignment_id")
    private UUID replacementAssignmentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public static ReviewAssignment pending(UUID submissionId, UUID reviewerId, OffsetDateTime assignedAt,
                                           OffsetDateTime deadline) {
        ReviewAssignment assignment = new ReviewAssignment();
        assignment.setId(UUID.randomUUID());
        assignment.setSubmissionId(submissionId);
        assignment.setReviewerId(reviewerId);
        assignment.setAssignedAt(assignedAt);
        assignment.setDeadline(deadline);
        assignment.setStatus(ReviewAssignmentStatus.PENDING);
        assignment.setCreatedAt(assignedAt);
        assignment.setUpdatedAt(assignedAt);
        return assignment;
    }
}
