package com.reviewflow.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewflow.model.Notification;
import com.reviewflow.model.NotificationType;
import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class JpaNotificationGateway implements NotificationGateway {

    static final String DEADLINE_WARNING_TITLE = "Review Deadline Warning";

    private final NotificationRepository notificationRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public boolean hasDeadlineReminder(UUID reviewerId, UUID assignmentId, int reminderIntervalHours) {
        return notificationRepository.existsByUserIdAndTypeAndAssignmentIdAndReminderIntervalHours(
                reviewerId,
                NotificationType.DEADLINE_REMINDER,
                assignmentId,
                reminderIntervalHours
        );
    }

    @Override
    @Transactional
    public boolean createDeadlineReminderIfAbsent(ReviewAssignment assignment, int reminderIntervalHours) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("assignmentId", assignment.getId().toString());
        data.put("submissionId", assignment.getSubmissionId().toString());
        data.put("reminderInterval", reminderIntervalHours);
        data.put("reason", "deadline_warning");
        data.put("deadline", assignment.getDeadline().toString());

        int inserted = notificationRepository.insertIfAbsent(
                UUID.randomUUID(),
                assignment.getReviewerId(),
                NotificationType.DEADLINE_REMINDER.name(),
                DEADLINE_WARNING_TITLE,
                reminderMessage(reminderIntervalHours),
                data.toString(),
                assignment.getId(),
                reminderIntervalHours,
                OffsetDateTime.now()
        );
        return inserted > 0;
    }

    @Override
    @Transactional
    public void notifyReviewAssigned(UUID reviewerId, UUID submissionId, UUID assignmentId) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("submissionId", submissionId.toString());
        data.put("assignmentId", assignmentId.toString());

        save(reviewerId, NotificationType.REVIEW_ASSIGNED, "New Review Assignment",
                "You have been assigned a new submission to review.", data, assignmentId);
    }

    @Override
    @Transactional
    public void notifyReviewReassigned(UUID previousReviewerId, UUID submissionId, UUID assignmentId) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("submissionId", submissionId.toString());
        data.put("assignmentId", assignmentId.toString());
        data.put("reason", "missed_deadline");

        save(previousReviewerId, NotificationType.REVIEW_REASSIGNED, "Review Reassigned",
                "A review you missed has been reassigned to another reviewer.", data, assignmentId);
    }

    static String reminderMessage(int reminderIntervalHours) {
        return "You have a review due in approximately " + reminderIntervalHours
                + " hour" + (reminderIntervalHours == 1 ? "" : "s") + ".";
    }

    private void save(UUID userId, NotificationType type, String title, String message, ObjectNode data,
                      UUID assignmentId) {
        Notification notification = new Notification();
        notification.setId(UUID.randomUUID());
        notification.setUserId(userId);
        notification.setType(type);
        notification.setTitle(title);
        notification.setMessage(message);
        notification.setData(data.toString());
        notification.setAssignmentId(assignmentId);
        notification.setRead(false);
        notification.setCreatedAt(OffsetDateTime.now());
        notificationRepository.save(notification);
    }
}
