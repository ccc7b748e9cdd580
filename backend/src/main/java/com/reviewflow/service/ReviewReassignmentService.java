package com.reviewflow.service;

import com.reviewflow.gateway.AdminAction;
import com.reviewflow.gateway.AuditLogGateway;
import com.reviewflow.gateway.NotificationGateway;
import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.ReviewAssignmentStatus;
import com.reviewflow.model.Submission;
import com.reviewflow.repository.ReviewAssignmentRepository;
import com.reviewflow.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Hands an assignment to a fresh reviewer: automatically once a MISSED row is past the grace
 * period, or on admin request for a live row. The replacement row and the release of the old
 * row commit together or not at all.
 */
@Service
@RequiredArgsConstructor
public class ReviewReassignmentService {

    private static final Logger log = LoggerFactory.getLogger(ReviewReassignmentService.class);

    static final String AUDIT_ACTION = "REVIEW_DEADLINE_REASSIGN";
    static final String RELEASE_REASON = "missed_deadline";
    static final String RESHUFFLE_AUDIT_ACTION = "REVIEW_ASSIGNMENT_RESHUFFLE";
    public static final String DEFAULT_RESHUFFLE_REASON = "manual:admin";

    private final ReviewerPoolService reviewerPoolService;
    private final ReviewerSelector reviewerSelector;
    private final ReviewAssignmentService reviewAssignmentService;
    private final ReviewAssignmentRepository reviewAssignmentRepository;
    private final SubmissionRepository submissionRepository;
    private final AuditLogGateway auditLogGateway;
    private final NotificationGateway notificationGateway;
    private final StorageRetryExecutor storageRetryExecutor;
    private final TransactionTemplate transactionTemplate;

    public ReassignmentOutcome reassign(ReviewAssignment missed) {
        if (missed.getStatus() != ReviewAssignmentStatus.MISSED) {
            return ReassignmentOutcome.failed("Assignment is not MISSED");
        }

        Submission submission = storageRetryExecutor.execute(
                "load submission " + missed.getSubmissionId(),
                () -> submissionRepository.findById(missed.getSubmissionId())
        ).orElse(null);
        if (submission == null) {
            return ReassignmentOutcome.failed("Submission not found");
        }

        ReviewerPoolOptions options = ReviewerPoolOptions.replacementFor(missed.getReviewerId(), submission.taskTypeSet());
        List<ReviewerCandidate> candidates = reviewerPoolService.findEligibleReviewers(
                submission.getId(),
                submission.getUserId(),
                options
        );
        ReviewerSelector.Selection selection = reviewerSelector.select(
                candidates,
                options.minimumReviewers(),
                options.allowPartialAssignment()
        );
        if (!selection.isSuccess()) {
            log.info("No replacement reviewer for assignment {}: {}", missed.getId(), selection.error());
            return ReassignmentOutcome.failed(selection.error());
        }

        OffsetDateTime now = OffsetDateTime.now();
        ReviewAssignment replacement = storageRetryExecutor.execute(
                "reassign assignment " + missed.getId(),
                () -> transactionTemplate.execute(status -> {
                    List<ReviewAssignment> inserted = reviewAssignmentService.insertAssignments(
                            missed.getSubmissionId(),
                            selection.selected(),
                            now
                    );
                    ReviewAssignment created = inserted.get(0);
                    int flipped = reviewAssignmentRepository.markReassigned(
                            missed.getId(),
                            created.getId(),
                            RELEASE_REASON,
                            now
                    );
                    if (flipped == 0) {
                        status.setRollbackOnly();
                        return null;
                    }
                    return created;
                })
        );
        if (replacement == null) {
            return ReassignmentOutcome.failed("Assignment was already reassigned");
        }

        reviewAssignmentService.refreshSubmissionReviewState(missed.getSubmissionId(), replacement.getDeadline())
                .ifPresent(warning -> log.warn("Reassignment of {}: {}", missed.getId(), warning));
        logReassignment(missed, replacement);
        notifyParticipants(missed, replacement);

        log.info(
                "Reassigned assignment {} from reviewer {} to reviewer {}",
                missed.getId(),
                missed.getReviewerId(),
                replacement.getReviewerId()
        );
        return ReassignmentOutcome.reassigned(replacement);
    }

    /**
     * Moves a PENDING or IN_PROGRESS assignment to another reviewer. The replacement keeps the
     * original deadline and never goes to anyone who has held this submission before.
     * With {@code dryRun} nothing is written and only the candidate is reported.
     */
    public ReshuffleResult reshuffle(UUID assignmentId, String reason, boolean dryRun) {
        String releaseReason = reason == null || reason.isBlank() ? DEFAULT_RESHUFFLE_REASON : reason.strip();

        ReviewAssignment current = storageRetryExecutor.execute(
                "load assignment " + assignmentId,
                () -> reviewAssignmentRepository.findById(assignmentId)
        ).orElse(null);
        if (current == null) {
            return ReshuffleResult.failed(ReshuffleFailureReason.NOT_FOUND, null, "Assignment not found");
        }
        if (current.getReleasedAt() != null || !current.getStatus().isActive()) {
            return ReshuffleResult.failed(
                    ReshuffleFailureReason.ALREADY_PROCESSED,
                    current,
                    "Assignment is " + current.getStatus() + " and can no longer be reshuffled"
            );
        }

        Submission submission = storageRetryExecutor.execute(
                "load submission " + current.getSubmissionId(),
                () -> submissionRepository.findById(current.getSubmissionId())
        ).orElse(null);
        if (submission == null) {
            return ReshuffleResult.failed(ReshuffleFailureReason.NOT_FOUND, current, "Submission not found");
        }

        ReviewerSelector.Selection selection = selectReshuffleCandidate(current, submission);
        if (dryRun) {
            UUID candidateId = selection.isSuccess() ? selection.selected().get(0).id() : null;
            return ReshuffleResult.preview(current, candidateId);
        }
        if (!selection.isSuccess()) {
            log.warn("No replacement reviewer for reshuffle of assignment {}: {}", assignmentId, selection.error());
            return ReshuffleResult.failed(ReshuffleFailureReason.NO_REPLACEMENT_AVAILABLE, current, selection.error());
        }

        UUID replacementReviewerId = selection.selected().get(0).id();
        OffsetDateTime now = OffsetDateTime.now();
        ReviewAssignment replacement = storageRetryExecutor.execute(
                "reshuffle assignment " + assignmentId,
                () -> transactionTemplate.execute(status -> {
                    ReviewAssignment created = reviewAssignmentRepository.saveAndFlush(ReviewAssignment.pending(
                            current.getSubmissionId(),
                            replacementReviewerId,
                            now,
                            current.getDeadline()
                    ));
                    int released = reviewAssignmentRepository.releaseToReplacement(
                            assignmentId,
                            ReviewAssignmentStatus.ACTIVE_STATUSES,
                            created.getId(),
                            releaseReason,
                            now
                    );
                    if (released == 0) {
                        status.setRollbackOnly();
                        return null;
                    }
                    return created;
                })
        );
        if (replacement == null) {
            return ReshuffleResult.failed(
                    ReshuffleFailureReason.ALREADY_PROCESSED,
                    current,
                    "Assignment was completed or released concurrently"
            );
        }

        ReviewAssignment released = storageRetryExecutor.execute(
                "load assignment " + assignmentId,
                () -> reviewAssignmentRepository.findById(assignmentId)
        ).orElse(current);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("submissionId", current.getSubmissionId().toString());
        details.put("previousReviewerId", current.getReviewerId().toString());
        details.put("newReviewerId", replacementReviewerId.toString());
        details.put("replacementAssignmentId", replacement.getId().toString());
        details.put("reason", releaseReason);
        audit(RESHUFFLE_AUDIT_ACTION, assignmentId, details);
        notifyParticipants(current, replacement);

        log.info(
                "Reshuffled assignment {} from reviewer {} to reviewer {} ({})",
                assignmentId,
                current.getReviewerId(),
                replacementReviewerId,
                releaseReason
        );
        return ReshuffleResult.reshuffled(released, replacement);
    }

    private ReviewerSelector.Selection selectReshuffleCandidate(ReviewAssignment current, Submission submission) {
        Set<UUID> previousReviewers = new HashSet<>();
        previousReviewers.add(current.getReviewerId());
        List<ReviewAssignment> history = storageRetryExecutor.execute(
                "load assignment history for submission " + submission.getId(),
                () -> reviewAssignmentRepository.findBySubmissionId(submission.getId())
        );
        for (ReviewAssignment assignment : history) {
            previousReviewers.add(assignment.getReviewerId());
        }

        ReviewerPoolOptions options = new ReviewerPoolOptions(null, previousReviewers, submission.taskTypeSet(), 1, false);
        List<ReviewerCandidate> candidates = reviewerPoolService.findEligibleReviewers(
                submission.getId(),
                submission.getUserId(),
                options
        );
        return reviewerSelector.select(candidates, 1, false);
    }

    private void logReassignment(ReviewAssignment missed, ReviewAssignment replacement) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("submissionId", missed.getSubmissionId().toString());
        details.put("previousReviewerId", missed.getReviewerId().toString());
        details.put("newReviewerId", replacement.getReviewerId().toString());
        details.put("replacementAssignmentId", replacement.getId().toString());
        details.put("reason", RELEASE_REASON);
        audit(AUDIT_ACTION, missed.getId(), details);
    }

    private void audit(String action, UUID assignmentId, Map<String, Object> details) {
        try {
            auditLogGateway.logAdminAction(AdminAction.system(
                    action,
                    "review_assignment",
                    assignmentId.toString(),
                    details
            ));
        } catch (RuntimeException ex) {
            log.warn("Failed to audit {} of {}", action, assignmentId, ex);
        }
    }

    private void notifyParticipants(ReviewAssignment previous, ReviewAssignment replacement) {
        try {
            notificationGateway.notifyReviewAssigned(
                    replacement.getReviewerId(),
                    replacement.getSubmissionId(),
                    replacement.getId()
            );
            notificationGateway.notifyReviewReassigned(
                    previous.getReviewerId(),
                    previous.getSubmissionId(),
                    previous.getId()
            );
        } catch (RuntimeException ex) {
            log.warn("Failed to send reassignment notifications for {}", previous.getId(), ex);
        }
    }

    public record ReassignmentOutcome(boolean reassigned, ReviewAssignment replacement, String reason) {

        static ReassignmentOutcome reassigned(ReviewAssignment replacement) {
            return new ReassignmentOutcome(true, replacement, null);
        }

        static ReassignmentOutcome failed(String reason) {
            return new ReassignmentOutcome(false, null, reason);
        }
    }
}
