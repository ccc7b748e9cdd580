package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Review window from assignment time, pushed to Monday when it would expire on a weekend.
 */
@Component
public class ReviewDeadlineCalculator {

    private final ReviewflowProperties reviewflowProperties;

    public ReviewDeadlineCalculator(ReviewflowProperties reviewflowProperties) {
        this.reviewflowProperties = reviewflowProperties;
    }

    public OffsetDateTime calculate(OffsetDateTime assignedAt) {
        Objects.requireNonNull(assignedAt, "assignedAt is required");
        ReviewflowProperties.Assignment assignment = reviewflowProperties.getAssignment();
        ZoneId zone = assignment.getDeadlineZone();

        ZonedDateTime deadline = assignedAt.atZoneSameInstant(zone).plusHours(assignment.getReviewWindowHours());
        DayOfWeek dayOfWeek = deadline.getDayOfWeek();
        if (dayOfWeek == DayOfWeek.SATURDAY) {
            deadline = deadline.plusDays(2);
        } else if (dayOfWeek == DayOfWeek.SUNDAY) {
            deadline = deadline.plusDays(1);
        }
        return deadline.toOffsetDateTime();
    }
}
