package com.reviewflow.service;

import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.ReviewAssignmentStatus;
import com.reviewflow.repository.ReviewAssignmentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves one overdue assignment to MISSED and charges its reviewer exactly once,
 * however many times the sweep retries it.
 */
@Service
@RequiredArgsConstructor
public class OverdueAssignmentHandler {

    private static final Logger log = LoggerFactory.getLogger(OverdueAssignmentHandler.class);

    private final ReviewAssignmentRepository reviewAssignmentRepository;
    private final ReviewerPenaltyService reviewerPenaltyService;
    private final StorageRetryExecutor storageRetryExecutor;
    private final TransactionTemplate transactionTemplate;

    public OverdueOutcome handleOverdue(UUID assignmentId) {
        OverdueOutcome outcome = storageRetryExecutor.execute(
                "mark assignment " + assignmentId + " missed",
                () -> transactionTemplate.execute(status -> {
                    ReviewAssignment assignment = reviewAssignmentRepository.findById(assignmentId).orElse(null);
                    if (assignment == null) {
                        return OverdueOutcome.SKIPPED;
                    }
                    if (assignment.getStatus() == ReviewAssignmentStatus.MISSED) {
                        return OverdueOutcome.ALREADY_MISSED;
                    }
                    if (!assignment.getStatus().isActive()) {
                        return OverdueOutcome.SKIPPED;
                    }

                    Optional<ReviewerPenaltyService.PenaltyApplication> penalty =
                            reviewerPenaltyService.applyMissedReviewPenalty(assignment);

                    int flipped = reviewAssignmentRepository.transitionStatus(
                            assignmentId,
                            ReviewAssignmentStatus.ACTIVE_STATUSES,
                            ReviewAssignmentStatus.MISSED,
                            OffsetDateTime.now()
                    );
                    if (flipped == 0) {
                        // Completed or marked by someone else since the reload.
                        status.setRollbackOnly();
                        return OverdueOutcome.SKIPPED;
                    }
                    return penalty.isPresent() ? OverdueOutcome.PENALIZED : OverdueOutcome.ALREADY_PENALIZED;
                })
        );

        if (outcome == OverdueOutcome.PENALIZED) {
            log.info("Assignment {} marked MISSED and reviewer penalized", assignmentId);
        } else if (outcome == OverdueOutcome.ALREADY_PENALIZED) {
            log.info("Assignment {} marked MISSED; penalty was already recorded", assignmentId);
        }
        return outcome;
    }

    public enum OverdueOutcome {
        PENALIZED,
        ALREADY_PENALIZED,
        ALREADY_MISSED,
        SKIPPED;

        public boolean penaltyApplied() {
            return this == PENALIZED;
        }
    }
}
