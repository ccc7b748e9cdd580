package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import com.reviewflow.gateway.XpLedgerGateway;
import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.XpTransactionType;
import com.reviewflow.repository.ReviewerRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Charges a reviewer for one missed assignment. The flat PENALTY entry keyed by
 * (reviewer, submission) doubles as the idempotency record for later sweeps.
 */
@Service
@RequiredArgsConstructor
public class ReviewerPenaltyService {

    private static final Logger log = LoggerFactory.getLogger(ReviewerPenaltyService.class);

    private final ReviewerRepository reviewerRepository;
    private final XpLedgerGateway xpLedgerGateway;
    private final PenaltyEscalationEngine penaltyEscalationEngine;
    private final ReviewflowProperties reviewflowProperties;

    /**
     * Must run inside the caller's transaction so the ledger claim and the counter move together.
     *
     * @return empty when the reviewer was already charged for this submission
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<PenaltyApplication> applyMissedReviewPenalty(ReviewAssignment assignment) {
        UUID reviewerId = assignment.getReviewerId();
        UUID submissionId = assignment.getSubmissionId();

        if (xpLedgerGateway.hasTransaction(reviewerId, XpTransactionType.PENALTY, submissionId)) {
            return Optional.empty();
        }

        int missedReviewXp = reviewflowProperties.getPenalty().getMissedReviewXp();
        boolean claimed = xpLedgerGateway.recordXpTransactionIfAbsent(
                reviewerId,
                missedReviewXp,
                XpTransactionType.PENALTY,
                "Missed review deadline for submission " + submissionId,
                submissionId
        ).isPresent();
        if (!claimed) {
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now();
        reviewerRepository.incrementMissedReviews(reviewerId, now);
        Integer missedReviews = reviewerRepository.findMissedReviewsById(reviewerId);
        if (missedReviews == null) {
            throw new IllegalStateException("Reviewer not found: " + reviewerId);
        }

        Optional<PenaltyEscalationEngine.EscalationDecision> escalation =
                penaltyEscalationEngine.evaluate(missedReviews, now);
        escalation.ifPresent(decision -> applyEscalation(reviewerId, decision, now));

        int clamped = reviewerRepository.clampNegativeTotalXp(reviewerId, now)
                + reviewerRepository.clampNegativeCurrentWeekXp(reviewerId, now);
        if (clamped > 0) {
            log.debug("Clamped negative XP for reviewer {}", reviewerId);
        }

        return Optional.of(new PenaltyApplication(reviewerId, assignment.getId(), missedReviews, escalation.orElse(null)));
    }

    private void applyEscalation(UUID reviewerId,
                                 PenaltyEscalationEngine.EscalationDecision decision,
                                 OffsetDateTime now) {
        if (decision.permanentBan()) {
            reviewerRepository.banFromReviewing(reviewerId, now);
        } else {
            reviewerRepository.pauseReviewingUntil(reviewerId, decision.pausedUntil(), now);
        }
        xpLedgerGateway.recordXpTransaction(
                reviewerId,
                decision.xpDelta(),
                XpTransactionType.PENALTY,
                decision.description(),
                null
        );
        log.warn(
                "Escalated reviewer {} at {} missed reviews: {}",
                reviewerId,
                decision.missedReviews(),
                decision.description()
        );
    }

    public record PenaltyApplication(
            UUID reviewerId,
            UUID assignmentId,
            int missedReviews,
            PenaltyEscalationEngine.EscalationDecision escalation
    ) {
        public boolean escalated() {
            return escalation != null;
        }
    }
}
