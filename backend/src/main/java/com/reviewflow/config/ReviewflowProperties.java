package com.reviewflow.config;

import com.reviewflow.model.UserRole;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Assignment policy, deadline sweep cadence, penalty ladder and storage retry settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "reviewflow")
public class ReviewflowProperties {

    private Assignment assignment = new Assignment();
    private Deadline deadline = new Deadline();
    private Penalty penalty = new Penalty();
    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Assignment {
        private int maxActiveAssignments = 5;
        private int minimumReviewers = 3;
        private int minimumXp = 50;
        private long reviewWindowHours = 48;
        private int maxManualReviewers = 5;
        private List<UserRole> reviewerRoles = new ArrayList<>(List.of(UserRole.REVIEWER, UserRole.ADMIN));

        /**
         * Zone used to decide whether a deadline lands on a weekend.
         */
        private ZoneId deadlineZone = ZoneId.of("UTC");
    }

    @Getter
    @Setter
    public static class Deadline {
        private boolean sweepEnabled = true;
        private long initialDelayMs = 60_000;
        private long sweepIntervalMs = 1_800_000;
        private List<Integer> reminderIntervalsHours = new ArrayList<>(List.of(24, 6, 1));
        private double reminderToleranceHours = 0.5;
        private double reassignmentDelayHours = 24;
        private double urgentThresholdHours = 6;
    }

    @Getter
    @Setter
    public static class Penalty {
        private int missedReviewXp = -10;
        private List<Threshold> thresholds = new ArrayList<>(List.of(
                Threshold.pause(4, Duration.ofDays(14), -100, "First strike: 4 missed reviews - 2 week pause from reviewing"),
                Threshold.pause(7, Duration.ofDays(28), -200, "Second strike: 7 missed reviews - 4 week pause from reviewing"),
                Threshold.ban(10, -500, "Permanent ban: 10 missed reviews - permanently excluded from reviewing")
        ));
    }

    /**
     * One rung of the missed-review ladder. A null {@code pauseDuration} means a permanent ban.
     */
    @Getter
    @Setter
    public static class Threshold {
        private int missedReviews;
        private Duration pauseDuration;
        private int xpDelta;
        private String description;

        static Threshold pause(int missedReviews, Duration pauseDuration, int xpDelta, String description) {
            Threshold threshold = new Threshold();
            threshold.setMissedReviews(missedReviews);
            threshold.setPauseDuration(pauseDuration);
            threshold.setXpDelta(xpDelta);
            threshold.setDescription(description);
            return threshold;
        }

        static Threshold ban(int missedReviews, int xpDelta, String description) {
            return pause(missedReviews, null, xpDelta, description);
        }

        public boolean isPermanentBan() {
            return pauseDuration == null;
        }
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofMillis(250);
        private double multiplier = 2.0;
    }

    /**
     * Reminder checkpoints are matched within a tolerance window, so a sweep that runs
     * less often than the window's width can step over a checkpoint entirely.
     */
    public void validateSweepCadence() {
        long toleranceWindowMs = Math.round(deadline.getReminderToleranceHours() * 2 * 3_600_000d);
        if (deadline.getSweepIntervalMs() <= 0) {
            throw new IllegalStateException("reviewflow.deadline.sweep-interval-ms must be positive");
        }
        if (deadline.getSweepIntervalMs() >= toleranceWindowMs) {
            throw new IllegalStateException(
                    "reviewflow.deadline.sweep-interval-ms (" + deadline.getSweepIntervalMs()
                            + ") must be shorter than twice the reminder tolerance (" + toleranceWindowMs + " ms)");
        }
    }
}
