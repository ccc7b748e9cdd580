package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Maps a reviewer's new missed-review count onto the escalation ladder. A rung fires only
 * when the count lands exactly on it, so each rung applies at most once per reviewer.
 */
@Component
@RequiredArgsConstructor
public class PenaltyEscalationEngine {

    private final ReviewflowProperties reviewflowProperties;

    public Optional<EscalationDecision> evaluate(int newMissedReviews, OffsetDateTime now) {
        for (ReviewflowProperties.Threshold threshold : reviewflowProperties.getPenalty().getThresholds()) {
            if (threshold.getMissedReviews() != newMissedReviews) {
                continue;
            }
            OffsetDateTime pausedUntil = threshold.isPermanentBan() ? null : now.plus(threshold.getPauseDuration());
            return Optional.of(new EscalationDecision(
                    newMissedReviews,
                    pausedUntil,
                    threshold.isPermanentBan(),
                    threshold.getXpDelta(),
                    threshold.getDescription()
            ));
        }
        return Optional.empty();
    }

    public record EscalationDecision(
            int missedReviews,
            OffsetDateTime pausedUntil,
            boolean permanentBan,
            int xpDelta,
            String description
    ) {
    }
}
