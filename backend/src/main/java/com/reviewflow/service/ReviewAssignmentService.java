package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import com.reviewflow.gateway.NotificationGateway;
import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.ReviewAssignmentStatus;
import com.reviewflow.model.Submission;
import com.reviewflow.model.SubmissionStatus;
import com.reviewflow.repository.ReviewAssignmentRepository;
import com.reviewflow.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Writes review assignments for a submission and keeps the submission's review state in step.
 */
@Service
@RequiredArgsConstructor
public class ReviewAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(ReviewAssignmentService.class);

    public static final String SUBMISSION_NOT_FOUND = "Submission not found";

    private final ReviewerPoolService reviewerPoolService;
    private final ReviewerSelector reviewerSelector;
    private final ReviewDeadlineCalculator reviewDeadlineCalculator;
    private final ReviewAssignmentRepository reviewAssignmentRepository;
    private final SubmissionRepository submissionRepository;
    private final NotificationGateway notificationGateway;
    private final StorageRetryExecutor storageRetryExecutor;
    private final TransactionTemplate transactionTemplate;
    private final ReviewflowProperties reviewflowProperties;

    public AssignmentResult assignReviewers(UUID submissionId, UUID authorUserId, ReviewerPoolOptions options) {
        ReviewerPoolOptions effective = options != null ? options : ReviewerPoolOptions.defaults();
        int minimumReviewers = effective.minimumReviewers() != null
                ? effective.minimumReviewers()
                : reviewflowProperties.getAssignment().getMinimumReviewers();
        List<String> warnings = new ArrayList<>();

        List<ReviewerCandidate> candidates;
        try {
            candidates = reviewerPoolService.findEligibleReviewers(submissionId, authorUserId, effective);
        } catch (RuntimeException ex) {
            log.error("Failed to load reviewer pool for submission {}", submissionId, ex);
            return AssignmentResult.failed(List.of("Failed to load reviewer pool: " + ex.getMessage()), warnings);
        }

        ReviewerSelector.Selection selection;
        try {
            selection = reviewerSelector.select(candidates, minimumReviewers, effective.allowPartialAssignment());
        } catch (IllegalArgumentException ex) {
            return AssignmentResult.failed(List.of(ex.getMessage()), warnings);
        }
        if (!selection.isSuccess()) {
            log.info("Could not assign reviewers to submission {}: {}", submissionId, selection.error());
            return AssignmentResult.failed(List.of(selection.error()), warnings);
        }
        if (selection.warning() != null) {
            warnings.add(selection.warning());
        }

        return writeAssignments(submissionId, selection.selected(), warnings);
    }

    /**
     * Admin path: assigns exactly the named reviewers after validating each one.
     */
    public AssignmentResult assignSpecificReviewers(UUID submissionId, List<UUID> reviewerIds) {
        List<String> warnings = new ArrayList<>();
        int maxManual = reviewflowProperties.getAssignment().getMaxManualReviewers();
        if (reviewerIds == null || reviewerIds.isEmpty() || reviewerIds.size() > maxManual) {
            return AssignmentResult.failed(List.of("Must assign between 1 and " + maxManual + " reviewers"), warnings);
        }

        Submission submission = storageRetryExecutor.execute(
                "load submission " + submissionId,
                () -> submissionRepository.findById(submissionId)
        ).orElse(null);
        if (submission == null) {
            return AssignmentResult.failed(List.of(SUBMISSION_NOT_FOUND), warnings);
        }

        Set<UUID> alreadyAssigned = new HashSet<>();
        for (ReviewAssignment live : storageRetryExecutor.execute(
                "load live assignments for submission " + submissionId,
                () -> reviewAssignmentRepository.findBySubmissionIdAndStatusIn(
                        submissionId,
                        ReviewAssignmentStatus.NON_TERMINAL_STATUSES
                ))) {
            alreadyAssigned.add(live.getReviewerId());
        }

        List<String> errors = new ArrayList<>();
        List<ReviewerCandidate> toAssign = new ArrayList<>();
        for (UUID reviewerId : new LinkedHashSet<>(reviewerIds)) {
            if (alreadyAssigned.contains(reviewerId)) {
                warnings.add("Reviewer " + reviewerId + " is already assigned to this submission");
                continue;
            }
            EligibilityCheck check = reviewerPoolService.canAssignReviewer(
                    reviewerId,
                    submission.getUserId(),
                    ReviewerPoolOptions.defaults()
            );
            if (!check.canAssign()) {
                errors.add("Reviewer " + reviewerId + ": " + check.reason());
                continue;
            }
            toAssign.add(new ReviewerCandidate(reviewerId, null, null, 0, 0, 0));
        }

        if (!errors.isEmpty()) {
            return AssignmentResult.failed(errors, warnings);
        }
        if (toAssign.isEmpty()) {
            return AssignmentResult.failed(
                    List.of("All specified reviewers are already assigned to this submission"),
                    warnings
            );
        }

        return writeAssignments(submissionId, toAssign, warnings);
    }

    /**
     * Eligibility of one reviewer for a stored submission, with the submission's author excluded.
     *
     * @return empty when the submission does not exist
     */
    public Optional<EligibilityCheck> checkReviewerEligibility(UUID reviewerId, UUID submissionId) {
        return storageRetryExecutor.execute(
                "load submission " + submissionId,
                () -> submissionRepository.findById(submissionId)
        ).map(submission -> reviewerPoolService.canAssignReviewer(
                reviewerId,
                submission.getUserId(),
                new ReviewerPoolOptions(null, Set.of(), submission.taskTypeSet(), null, false)
        ));
    }

    /**
     * Inserts one PENDING row per reviewer with a shared deadline. Joins the caller's
     * transaction when there is one.
     */
    List<ReviewAssignment> insertAssignments(UUID submissionId, List<ReviewerCandidate> reviewers, OffsetDateTime now) {
        OffsetDateTime deadline = reviewDeadlineCalculator.calculate(now);
        List<ReviewAssignment> assignments = new ArrayList<>();
        for (ReviewerCandidate reviewer : reviewers) {
            assignments.add(ReviewAssignment.pending(submissionId, reviewer.id(), now, deadline));
        }
        return reviewAssignmentRepository.saveAllAndFlush(assignments);
    }

    /**
     * Recomputes the live review count and marks the submission as under peer review.
     *
     * @return a warning when the submission could not be updated
     */
    Optional<String> refreshSubmissionReviewState(UUID submissionId, OffsetDateTime reviewDeadline) {
        try {
            boolean updated = storageRetryExecutor.execute(
                    "update submission " + submissionId,
                    () -> Boolean.TRUE.equals(transactionTemplate.execute(status -> {
                        Submission submission = submissionRepository.findById(submissionId).orElse(null);
                        if (submission == null) {
                            return false;
                        }
                        long liveCount = reviewAssignmentRepository.countBySubmissionIdAndStatusNot(
                                submissionId,
                                ReviewAssignmentStatus.REASSIGNED
                        );
                        submission.setStatus(SubmissionStatus.UNDER_PEER_REVIEW);
                        submission.setReviewDeadline(reviewDeadline);
                        submission.setReviewCount((int) liveCount);
                        submission.setUpdatedAt(OffsetDateTime.now());
                        submissionRepository.save(submission);
                        return true;
                    }))
            );
            if (!updated) {
                return Optional.of("Failed to update submission status: submission " + submissionId + " not found");
            }
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Failed to update review state of submission {}", submissionId, ex);
            return Optional.of("Failed to update submission status: " + ex.getMessage());
        }
    }

    private AssignmentResult writeAssignments(UUID submissionId,
                                              List<ReviewerCandidate> reviewers,
                                              List<String> warnings) {
        OffsetDateTime now = OffsetDateTime.now();
        List<ReviewAssignment> created;
        try {
            created = storageRetryExecutor.execute(
                    "create assignments for submission " + submissionId,
                    () -> transactionTemplate.execute(status -> insertAssignments(submissionId, reviewers, now))
            );
        } catch (RuntimeException ex) {
            log.error("Failed to create assignments for submission {}", submissionId, ex);
            return AssignmentResult.failed(List.of("Failed to create assignments: " + ex.getMessage()), warnings);
        }

        OffsetDateTime deadline = created.isEmpty() ? reviewDeadlineCalculator.calculate(now) : created.get(0).getDeadline();
        refreshSubmissionReviewState(submissionId, deadline).ifPresent(warnings::add);

        List<UUID> assignmentIds = new ArrayList<>();
        for (ReviewAssignment assignment : created) {
            assignmentIds.add(assignment.getId());
            try {
                notificationGateway.notifyReviewAssigned(assignment.getReviewerId(), submissionId, assignment.getId());
            } catch (RuntimeException ex) {
                log.warn("Failed to notify reviewer {} about assignment {}", assignment.getReviewerId(), assignment.getId(), ex);
                warnings.add("Failed to notify reviewer " + assignment.getReviewerId() + ": " + ex.getMessage());
            }
        }

        log.info("Assigned {} reviewer(s) to submission {} with deadline {}", created.size(), submissionId, deadline);
        return new AssignmentResult(true, reviewers, assignmentIds, List.of(), warnings);
    }
}
