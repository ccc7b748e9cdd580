package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import com.reviewflow.gateway.AdminAction;
import com.reviewflow.gateway.AuditLogGateway;
import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.ReviewAssignmentStatus;
import com.reviewflow.repository.ReviewAssignmentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives the assignment deadline state machine: reminders before the deadline,
 * MISSED plus penalty once it passes, reassignment after the grace period.
 */
@Service
@RequiredArgsConstructor
public class DeadlineMonitorService {

    private static final Logger log = LoggerFactory.getLogger(DeadlineMonitorService.class);

    static final String EXTEND_AUDIT_ACTION = "REVIEW_DEADLINE_EXTENDED";

    private final ReviewAssignmentRepository reviewAssignmentRepository;
    private final DeadlineReminderService deadlineReminderService;
    private final OverdueAssignmentHandler overdueAssignmentHandler;
    private final ReviewReassignmentService reviewReassignmentService;
    private final AuditLogGateway auditLogGateway;
    private final StorageRetryExecutor storageRetryExecutor;
    private final TransactionTemplate transactionTemplate;
    private final ReviewflowProperties reviewflowProperties;

    public DeadlineMonitorResult processDeadlines() {
        OffsetDateTime startedAt = OffsetDateTime.now();
        List<String> errors = new ArrayList<>();

        List<ReviewAssignment> assignments;
        try {
            assignments = storageRetryExecutor.execute(
                    "load assignments for deadline sweep",
                    () -> reviewAssignmentRepository.findByStatusInOrderByDeadlineAsc(
                            ReviewAssignmentStatus.NON_TERMINAL_STATUSES
                    )
            );
        } catch (RuntimeException ex) {
            log.error("Deadline sweep could not load assignments", ex);
            errors.add("Failed to fetch assignments: " + ex.getMessage());
            return new DeadlineMonitorResult(startedAt, 0, 0, 0, 0, errors);
        }

        int processed = 0;
        int reminders = 0;
        int reassignments = 0;
        int penalties = 0;
        double reassignmentDelayHours = reviewflowProperties.getDeadline().getReassignmentDelayHours();

        for (ReviewAssignment assignment : assignments) {
            processed++;
            try {
                double hoursUntilDeadline = hoursBetween(OffsetDateTime.now(), assignment.getDeadline());
                switch (assignment.getStatus()) {
                    case MISSED -> {
                        if (Math.abs(hoursUntilDeadline) >= reassignmentDelayHours
                                && reviewReassignmentService.reassign(assignment).reassigned()) {
                            reassignments++;
                        }
                    }
                    case PENDING, IN_PROGRESS -> {
                        if (hoursUntilDeadline <= 0) {
                            if (overdueAssignmentHandler.handleOverdue(assignment.getId()).penaltyApplied()) {
                                penalties++;
                            }
                        } else if (deadlineReminderService.sendReminderIfDue(assignment, hoursUntilDeadline)) {
                            reminders++;
                        }
                    }
                    case COMPLETED, REASSIGNED -> {
                        // Terminal rows are not loaded by the sweep query.
                    }
                }
            } catch (RuntimeException ex) {
                log.error("Deadline sweep failed for assignment {}", assignment.getId(), ex);
                errors.add("Assignment " + assignment.getId() + ": " + ex.getMessage());
            }
        }

        return new DeadlineMonitorResult(startedAt, processed, reminders, reassignments, penalties, errors);
    }

    public List<DeadlineStatus> getDeadlineStatuses() {
        OffsetDateTime now = OffsetDateTime.now();
        double urgentThresholdHours = reviewflowProperties.getDeadline().getUrgentThresholdHours();

        List<ReviewAssignment> active = storageRetryExecutor.execute(
                "load active assignments",
                () -> reviewAssignmentRepository.findByStatusInOrderByDeadlineAsc(ReviewAssignmentStatus.ACTIVE_STATUSES)
        );

        List<DeadlineStatus> statuses = new ArrayList<>();
        for (ReviewAssignment assignment : active) {
            double hoursRemaining = hoursBetween(now, assignment.getDeadline());
            statuses.add(new DeadlineStatus(
                    assignment.getId(),
                    assignment.getSubmissionId(),
                    assignment.getReviewerId(),
                    assignment.getStatus(),
                    assignment.getDeadline(),
                    DeadlineUrgency.of(hoursRemaining, urgentThresholdHours),
                    Math.round(hoursRemaining * 10) / 10.0
            ));
        }
        return statuses;
    }

    public List<DeadlineStatus> getUrgentAssignments() {
        return getDeadlineStatuses().stream()
                .filter(status -> status.urgency() != DeadlineUrgency.UPCOMING)
                .toList();
    }

    /**
     * Pushes an active assignment's deadline back.
     *
     * @return false when the assignment is unknown, no longer active, or the extension is not positive
     */
    public boolean extendDeadline(UUID assignmentId, double additionalHours, String reason) {
        if (assignmentId == null || additionalHours <= 0) {
            return false;
        }

        ReviewAssignment extended = storageRetryExecutor.execute(
                "extend deadline of " + assignmentId,
                () -> transactionTemplate.execute(status -> {
                    ReviewAssignment assignment = reviewAssignmentRepository.findById(assignmentId).orElse(null);
                    if (assignment == null || !assignment.getStatus().isActive()) {
                        return null;
                    }
                    OffsetDateTime previousDeadline = assignment.getDeadline();
                    assignment.setDeadline(previousDeadline.plus(Duration.ofSeconds(Math.round(additionalHours * 3600))));
                    assignment.setUpdatedAt(OffsetDateTime.now());
                    reviewAssignmentRepository.save(assignment);
                    return assignment;
                })
        );
        if (extended == null) {
            return false;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("additionalHours", additionalHours);
        details.put("newDeadline", extended.getDeadline().toString());
        details.put("reason", reason);
        try {
            auditLogGateway.logAdminAction(AdminAction.system(
                    EXTEND_AUDIT_ACTION,
                    "review_assignment",
                    assignmentId.toString(),
                    details
            ));
        } catch (RuntimeException ex) {
            log.warn("Failed to audit deadline extension of {}", assignmentId, ex);
        }

        log.info("Extended deadline of assignment {} by {}h to {}", assignmentId, additionalHours, extended.getDeadline());
        return true;
    }

    static double hoursBetween(OffsetDateTime from, OffsetDateTime to) {
        return Duration.between(from, to).toMillis() / 3_600_000d;
    }
}
