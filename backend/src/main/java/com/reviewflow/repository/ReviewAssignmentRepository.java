package com.reviewflow.repository;

import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.ReviewAssignmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ReviewAssignmentRepository extends JpaRepository<ReviewAssignment, UUID> {

    List<ReviewAssignment> findByStatusInOrderByDeadlineAsc(Collection<ReviewAssignmentStatus> statuses);

    List<ReviewAssignment> findBySubmissionIdAndStatusIn(UUID submissionId,
                                                         Collection<ReviewAssignmentStatus> statuses);

    List<ReviewAssignment> findBySubmissionId(UUID submissionId);

    long countBySubmissionIdAndStatusNot(UUID submissionId, ReviewAssignmentStatus status);

    long countByReviewerIdAndStatusIn(UUID reviewerId, Collection<ReviewAssignmentStatus> statuses);

    long countByReviewerIdAndStatusAndCompletedAtGreaterThanEqual(UUID reviewerId,
                                                                 ReviewAssignmentStatus status,
                                                                 OffsetDateTime completedSince);

    @Query("SELECT a.reviewerId AS reviewerId, COUNT(a) AS activeCount " +
            "FROM ReviewAssignment a " +
            "WHERE a.reviewerId IN :reviewerIds " +
            "AND a.status IN :statuses " +
            "GROUP BY a.reviewerId")
    List<ReviewerAssignmentCount> countByReviewerIdsAndStatuses(
            @Param("reviewerIds") Collection<UUID> reviewerIds,
            @Param("statuses") Collection<ReviewAssignmentStatus> statuses);

    /**
     * Guarded status flip; returns 0 when the row already left {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ReviewAssignment a " +
            "SET a.status = :target, a.updatedAt = :updatedAt " +
            "WHERE a.id = :assignmentId AND a.status IN :expected")
    int transitionStatus(@Param("assignmentId") UUID assignmentId,
                         @Param("expected") Collection<ReviewAssignmentStatus> expected,
                         @Param("target") ReviewAssignmentStatus target,
                         @Param("updatedAt") OffsetDateTime updatedAt);

    /**
     * Retires a MISSED row in favour of its replacement. Returns 0 when another sweep got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ReviewAssignment a " +
            "SET a.status = com.reviewflow.model.ReviewAssignmentStatus.REASSIGNED, " +
            "a.replacementAssignmentId = :replacementId, " +
            "a.releasedAt = :releasedAt, " +
            "a.releaseReason = :releaseReason, " +
            "a.updatedAt = :releasedAt " +
            "WHERE a.id = :assignmentId " +
            "AND a.status = com.reviewflow.model.ReviewAssignmentStatus.MISSED")
    int markReassigned(@Param("assignmentId") UUID assignmentId,
                       @Param("replacementId") UUID replacementId,
                       @Param("releaseReason") String releaseReason,
                       @Param("releasedAt") OffsetDateTime releasedAt);

    /**
     * Releases a still-live row in favour of its replacement. Returns 0 when the row was
     * released already or left {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ReviewAssignment a " +
            "SET a.status = com.reviewflow.model.ReviewAssignmentStatus.REASSIGNED, " +
            "a.replacementAssignmentId = :replacementId, " +
            "a.releasedAt = :releasedAt, " +
            "a.releaseReason = :releaseReason, " +
            "a.updatedAt = :releasedAt " +
            "WHERE a.id = :assignmentId " +
            "AND a.releasedAt IS NULL " +
            "AND a.status IN :expected")
    int releaseToReplacement(@Param("assignmentId") UUID assignmentId,
                             @Param("expected") Collection<ReviewAssignmentStatus> expected,
                             @Param("replacementId") UUID replacementId,
                             @Param("releaseReason") String releaseReason,
                             @Param("releasedAt") OffsetDateTime releasedAt);
}
