package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.ReviewAssignmentStatus;
import com.reviewflow.model.Reviewer;
import com.reviewflow.model.UserRole;
import com.reviewflow.repository.ReviewAssignmentRepository;
import com.reviewflow.repository.ReviewerAssignmentCount;
import com.reviewflow.repository.ReviewerRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reviewer pool queries: who may review a submission right now, and how loaded they are.
 */
@Service
@RequiredArgsConstructor
public class ReviewerPoolService {

    private static final Logger log = LoggerFactory.getLogger(ReviewerPoolService.class);

    private final ReviewerRepository reviewerRepository;
    private final ReviewAssignmentRepository reviewAssignmentRepository;
    private final StorageRetryExecutor storageRetryExecutor;
    private final ReviewflowProperties reviewflowProperties;

    /**
     * Candidates that pass every eligibility rule, ordered by {@link ReviewerSelector#WORKLOAD_ORDER}.
     * An empty list is a valid answer; callers decide whether it is fatal.
     */
    public List<ReviewerCandidate> findEligibleReviewers(UUID submissionId,
                                                         UUID authorUserId,
                                                         ReviewerPoolOptions options) {
        ReviewerPoolOptions effective = options != null ? options : ReviewerPoolOptions.defaults();
        int maxActive = resolveMaxActiveAssignments(effective);
        OffsetDateTime now = OffsetDateTime.now();

        Set<UUID> excluded = new HashSet<>(effective.excludeUserIds());
        if (authorUserId != null) {
            excluded.add(authorUserId);
        }
        if (submissionId != null) {
            excluded.addAll(reviewersHoldingLiveAssignment(submissionId));
        }

        List<Reviewer> pool = storageRetryExecutor.execute(
                "load reviewer pool",
                () -> reviewerRepository.findByRoleIn(reviewerRoles())
        );
        List<Reviewer> remaining = pool.stream()
                .filter(reviewer -> !excluded.contains(reviewer.getId()))
                .toList();
        if (remaining.isEmpty()) {
            return List.of();
        }

        Map<UUID, Integer> activeCounts = countActiveAssignments(remaining);

        List<ReviewerCandidate> candidates = new ArrayList<>();
        for (Reviewer reviewer : remaining) {
            int activeAssignments = activeCounts.getOrDefault(reviewer.getId(), 0);
            String rejection = rejectionReason(reviewer, activeAssignments, maxActive, effective.taskTypes(), now);
            if (rejection != null) {
                log.debug("Reviewer {} not eligible for submission {}: {}", reviewer.getId(), submissionId, rejection);
                continue;
            }
            candidates.add(toCandidate(reviewer, activeAssignments));
        }

        candidates.sort(ReviewerSelector.WORKLOAD_ORDER);
        return candidates;
    }

    public EligibilityCheck canAssignReviewer(UUID reviewerId, UUID authorUserId, ReviewerPoolOptions options) {
        if (reviewerId == null) {
            return EligibilityCheck.denied("Reviewer not found");
        }
        if (reviewerId.equals(authorUserId)) {
            return EligibilityCheck.denied("Cannot review own submission");
        }

        Reviewer reviewer = storageRetryExecutor.execute(
                "load reviewer " + reviewerId,
                () -> reviewerRepository.findById(reviewerId)
        ).orElse(null);
        if (reviewer == null) {
            return EligibilityCheck.denied("Reviewer not found");
        }

        ReviewerPoolOptions effective = options != null ? options : ReviewerPoolOptions.defaults();
        long activeAssignments = storageRetryExecutor.execute(
                "count active assignments for " + reviewerId,
                () -> reviewAssignmentRepository.countByReviewerIdAndStatusIn(
                        reviewerId,
                        ReviewAssignmentStatus.ACTIVE_STATUSES
                )
        );

        String rejection = rejectionReason(
                reviewer,
                (int) activeAssignments,
                resolveMaxActiveAssignments(effective),
                effective.taskTypes(),
                OffsetDateTime.now()
        );
        return rejection == null ? EligibilityCheck.allowed() : EligibilityCheck.denied(rejection);
    }

    public ReviewerWorkload getReviewerWorkload(UUID reviewerId) {
        OffsetDateTime weekStart = OffsetDateTime.now()
                .atZoneSameInstant(reviewflowProperties.getAssignment().getDeadlineZone())
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                .truncatedTo(ChronoUnit.DAYS)
                .toOffsetDateTime();

        long active = storageRetryExecutor.execute(
                "count active assignments for " + reviewerId,
                () -> reviewAssignmentRepository.countByReviewerIdAndStatusIn(
                        reviewerId,
                        ReviewAssignmentStatus.ACTIVE_STATUSES
                )
        );
        long completedThisWeek = storageRetryExecutor.execute(
                "count completed reviews for " + reviewerId,
                () -> reviewAssignmentRepository.countByReviewerIdAndStatusAndCompletedAtGreaterThanEqual(
                        reviewerId,
                        ReviewAssignmentStatus.COMPLETED,
                        weekStart
                )
        );
        int missedReviews = storageRetryExecutor.execute(
                "load reviewer " + reviewerId,
                () -> reviewerRepository.findById(reviewerId)
        ).map(Reviewer::getMissedReviews).orElse(0);

        return new ReviewerWorkload(reviewerId, active, completedThisWeek, missedReviews);
    }

    private String rejectionReason(Reviewer reviewer,
                                   int activeAssignments,
                                   int maxActiveAssignments,
                                   Set<String> requestedTaskTypes,
                                   OffsetDateTime now) {
        if (reviewer.getRole() == null || !reviewerRoles().contains(reviewer.getRole())) {
            return "User does not have reviewer privileges";
        }
        if (reviewer.getPreferences() != null && reviewer.getPreferences().isOptedOutAt(now)) {
            return "Reviewer is temporarily unavailable";
        }
        if (reviewer.isPausedAt(now)) {
            return "Reviewer is paused from reviewing";
        }
        if (activeAssignments >= maxActiveAssignments) {
            return "Reviewer has too many active assignments";
        }
        int minimumXp = reviewflowProperties.getAssignment().getMinimumXp();
        if (reviewer.getRole() != UserRole.ADMIN && valueOf(reviewer.getTotalXp()) < minimumXp) {
            return "Insufficient experience (minimum " + minimumXp + " XP required)";
        }
        if (reviewer.getPreferences() != null && !reviewer.getPreferences().acceptsAnyTaskType(requestedTaskTypes)) {
            return "Reviewer does not cover the requested task types";
        }
        return null;
    }

    private Set<UUID> reviewersHoldingLiveAssignment(UUID submissionId) {
        List<ReviewAssignment> live = storageRetryExecutor.execute(
                "load live assignments for submission " + submissionId,
                () -> reviewAssignmentRepository.findBySubmissionIdAndStatusIn(
                        submissionId,
                        ReviewAssignmentStatus.NON_TERMINAL_STATUSES
                )
        );
        Set<UUID> reviewerIds = new HashSet<>();
        for (ReviewAssignment assignment : live) {
            reviewerIds.add(assignment.getReviewerId());
        }
        return reviewerIds;
    }

    private Map<UUID, Integer> countActiveAssignments(List<Reviewer> reviewers) {
        List<UUID> reviewerIds = reviewers.stream().map(Reviewer::getId).toList();
        List<ReviewerAssignmentCount> rows = storageRetryExecutor.execute(
                "count active assignments",
                () -> reviewAssignmentRepository.countByReviewerIdsAndStatuses(
                        reviewerIds,
                        ReviewAssignmentStatus.ACTIVE_STATUSES
                )
        );
        Map<UUID, Integer> counts = new HashMap<>();
        for (ReviewerAssignmentCount row : rows) {
            counts.put(row.getReviewerId(), (int) row.getActiveCount());
        }
        return counts;
    }

    private int resolveMaxActiveAssignments(ReviewerPoolOptions options) {
        Integer override = options.maxActiveAssignments();
        return override != null ? override : reviewflowProperties.getAssignment().getMaxActiveAssignments();
    }

    private Set<UserRole> reviewerRoles() {
        return Set.copyOf(reviewflowProperties.getAssignment().getReviewerRoles());
    }

    private static ReviewerCandidate toCandidate(Reviewer reviewer, int activeAssignments) {
        return new ReviewerCandidate(
                reviewer.getId(),
                reviewer.displayName(),
                reviewer.getRole(),
                valueOf(reviewer.getTotalXp()),
                valueOf(reviewer.getMissedReviews()),
                activeAssignments
        );
    }

    private static int valueOf(Integer value) {
        return value == null ? 0 : value;
    }
}
