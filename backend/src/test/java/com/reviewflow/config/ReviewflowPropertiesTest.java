package com.reviewflow.config;

import com.reviewflow.model.UserRole;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviewflowPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(ReviewflowProperties.class);

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            ReviewflowProperties properties = context.getBean(ReviewflowProperties.class);

            assertEquals(5, properties.getAssignment().getMaxActiveAssignments());
            assertEquals(3, properties.getAssignment().getMinimumReviewers());
            assertEquals(50, properties.getAssignment().getMinimumXp());
            assertEquals(48, properties.getAssignment().getReviewWindowHours());
            assertEquals(List.of(UserRole.REVIEWER, UserRole.ADMIN), properties.getAssignment().getReviewerRoles());
            assertTrue(properties.getDeadline().isSweepEnabled());
            assertEquals(List.of(24, 6, 1), properties.getDeadline().getReminderIntervalsHours());
            assertEquals(0.5, properties.getDeadline().getReminderToleranceHours());
            assertEquals(24.0, properties.getDeadline().getReassignmentDelayHours());
            assertEquals(-10, properties.getPenalty().getMissedReviewXp());
            assertEquals(3, properties.getRetry().getMaxRetries());
            assertEquals(Duration.ofMillis(250), properties.getRetry().getInitialDelay());

            List<ReviewflowProperties.Threshold> thresholds = properties.getPenalty().getThresholds();
            assertEquals(3, thresholds.size());
            assertEquals(4, thresholds.get(0).getMissedReviews());
            assertEquals(Duration.ofDays(14), thresholds.get(0).getPauseDuration());
            assertEquals(-100, thresholds.get(0).getXpDelta());
            assertEquals(Duration.ofDays(28), thresholds.get(1).getPauseDuration());
            assertEquals(-200, thresholds.get(1).getXpDelta());
            assertTrue(thresholds.get(2).isPermanentBan());
            assertEquals(-500, thresholds.get(2).getXpDelta());
        });
    }

    @Test
    void bindsOverrides() {
        contextRunner
                .withPropertyValues(
                        "reviewflow.assignment.minimum-reviewers=2",
                        "reviewflow.assignment.deadline-zone=Europe/Berlin",
                        "reviewflow.deadline.sweep-enabled=false",
                        "reviewflow.deadline.sweep-interval-ms=600000",
                        "reviewflow.deadline.reminder-intervals-hours=12,2",
                        "reviewflow.penalty.thresholds[0].missed-reviews=3",
                        "reviewflow.penalty.thresholds[0].pause-duration=7d",
                        "reviewflow.penalty.thresholds[0].xp-delta=-50",
                        "reviewflow.penalty.thresholds[0].description=Early strike",
                        "reviewflow.retry.initial-delay=1s"
                )
                .run(context -> {
                    ReviewflowProperties properties = context.getBean(ReviewflowProperties.class);

                    assertEquals(2, properties.getAssignment().getMinimumReviewers());
                    assertEquals(ZoneId.of("Europe/Berlin"), properties.getAssignment().getDeadlineZone());
                    assertFalse(properties.getDeadline().isSweepEnabled());
                    assertEquals(600_000L, properties.getDeadline().getSweepIntervalMs());
                    assertEquals(List.of(12, 2), properties.getDeadline().getReminderIntervalsHours());
                    assertEquals(1, properties.getPenalty().getThresholds().size());
                    assertEquals(Duration.ofDays(7), properties.getPenalty().getThresholds().get(0).getPauseDuration());
                    assertEquals(Duration.ofSeconds(1), properties.getRetry().getInitialDelay());
                });
    }

    @Test
    void thresholdWithoutPauseDurationIsPermanentBan() {
        contextRunner
                .withPropertyValues(
                        "reviewflow.penalty.thresholds[0].missed-reviews=2",
                        "reviewflow.penalty.thresholds[0].xp-delta=-1000"
                )
                .run(context -> {
                    ReviewflowProperties.Threshold threshold =
                            context.getBean(ReviewflowProperties.class).getPenalty().getThresholds().get(0);
                    assertNull(threshold.getPauseDuration());
                    assertTrue(threshold.isPermanentBan());
                });
    }

    @Test
    void sweepCadenceMustBeShorterThanReminderWindow() {
        ReviewflowProperties properties = new ReviewflowProperties();
        assertDoesNotThrow(properties::validateSweepCadence);

        properties.getDeadline().setSweepIntervalMs(3_600_000);
        assertThrows(IllegalStateException.class, properties::validateSweepCadence);

        properties.getDeadline().setReminderToleranceHours(1.0);
        assertDoesNotThrow(properties::validateSweepCadence);

        properties.getDeadline().setSweepIntervalMs(0);
        assertThrows(IllegalStateException.class, properties::validateSweepCadence);
    }
}
