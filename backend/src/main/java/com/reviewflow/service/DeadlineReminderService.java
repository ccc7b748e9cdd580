package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import com.reviewflow.gateway.NotificationGateway;
import com.reviewflow.model.ReviewAssignment;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.OptionalInt;

@Service
@RequiredArgsConstructor
public class DeadlineReminderService {

    private static final Logger log = LoggerFactory.getLogger(DeadlineReminderService.class);

    private final NotificationGateway notificationGateway;
    private final StorageRetryExecutor storageRetryExecutor;
    private final ReviewflowProperties reviewflowProperties;

    /**
     * The reminder checkpoint {@code hoursUntilDeadline} falls strictly within tolerance of, if any.
     */
    public OptionalInt matchReminderInterval(double hoursUntilDeadline) {
        ReviewflowProperties.Deadline deadline = reviewflowProperties.getDeadline();
        for (Integer interval : deadline.getReminderIntervalsHours()) {
            if (Math.abs(hoursUntilDeadline - interval) < deadline.getReminderToleranceHours()) {
                return OptionalInt.of(interval);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @return true when a reminder was written by this call
     */
    public boolean sendReminderIfDue(ReviewAssignment assignment, double hoursUntilDeadline) {
        OptionalInt interval = matchReminderInterval(hoursUntilDeadline);
        if (interval.isEmpty()) {
            return false;
        }
        int reminderIntervalHours = interval.getAsInt();

        boolean alreadySent = storageRetryExecutor.execute(
                "check reminder for assignment " + assignment.getId(),
                () -> notificationGateway.hasDeadlineReminder(
                        assignment.getReviewerId(),
                        assignment.getId(),
                        reminderIntervalHours
                )
        );
        if (alreadySent) {
            return false;
        }

        boolean created = storageRetryExecutor.execute(
                "send reminder for assignment " + assignment.getId(),
                () -> notificationGateway.createDeadlineReminderIfAbsent(assignment, reminderIntervalHours)
        );
        if (created) {
            log.info(
                    "Sent {}h deadline reminder to reviewer {} for assignment {}",
                    reminderIntervalHours,
                    assignment.getReviewerId(),
                    assignment.getId()
            );
        }
        return created;
    }
}
