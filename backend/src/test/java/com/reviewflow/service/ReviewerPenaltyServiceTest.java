package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import com.reviewflow.gateway.XpLedgerGateway;
import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.XpTransaction;
import com.reviewflow.model.XpTransactionType;
import com.reviewflow.repository.ReviewerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewerPenaltyServiceTest {

    private static final UUID REVIEWER_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID SUBMISSION_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");

    @Mock
    private ReviewerRepository reviewerRepository;

    @Mock
    private XpLedgerGateway xpLedgerGateway;

    private ReviewerPenaltyService reviewerPenaltyService;
    private ReviewAssignment assignment;

    @BeforeEach
    void setUp() {
        ReviewflowProperties properties = new ReviewflowProperties();
        reviewerPenaltyService = new ReviewerPenaltyService(
                reviewerRepository,
                xpLedgerGateway,
                new PenaltyEscalationEngine(properties),
                properties
        );
        OffsetDateTime assignedAt = OffsetDateTime.now().minusDays(3);
        assignment = ReviewAssignment.pending(SUBMISSION_ID, REVIEWER_ID, assignedAt, assignedAt.plusHours(48));
    }

    @Test
    void firstMissRecordsKeyedPenaltyAndIncrementsCounter() {
        stubClaim(true);
        when(reviewerRepository.findMissedReviewsById(REVIEWER_ID)).thenReturn(1);

        Optional<ReviewerPenaltyService.PenaltyApplication> applied =
                reviewerPenaltyService.applyMissedReviewPenalty(assignment);

        assertTrue(applied.isPresent());
        assertEquals(1, applied.get().missedReviews());
        assertFalse(applied.get().escalated());
        verify(xpLedgerGateway).recordXpTransactionIfAbsent(
                eq(REVIEWER_ID), eq(-10), eq(XpTransactionType.PENALTY), anyString(), eq(SUBMISSION_ID));
        verify(reviewerRepository).incrementMissedReviews(eq(REVIEWER_ID), any());
        verify(reviewerRepository).clampNegativeTotalXp(eq(REVIEWER_ID), any());
        verify(reviewerRepository).clampNegativeCurrentWeekXp(eq(REVIEWER_ID), any());
        verify(reviewerRepository, never()).pauseReviewingUntil(any(), any(), any());
    }

    @Test
    void existingLedgerEntryShortCircuitsWithoutMutation() {
        when(xpLedgerGateway.hasTransaction(REVIEWER_ID, XpTransactionType.PENALTY, SUBMISSION_ID)).thenReturn(true);

        Optional<ReviewerPenaltyService.PenaltyApplication> applied =
                reviewerPenaltyService.applyMissedReviewPenalty(assignment);

        assertTrue(applied.isEmpty());
        verify(xpLedgerGateway, never()).recordXpTransactionIfAbsent(any(), anyInt(), any(), any(), any());
        verifyNoInteractions(reviewerRepository);
    }

    @Test
    void lostClaimRaceIsTreatedAsAlreadyPenalized() {
        stubClaim(false);

        Optional<ReviewerPenaltyService.PenaltyApplication> applied =
                reviewerPenaltyService.applyMissedReviewPenalty(assignment);

        assertTrue(applied.isEmpty());
        verifyNoInteractions(reviewerRepository);
    }

    @Test
    void fourthMissPausesReviewerAndRecordsEscalationEntry() {
        stubClaim(true);
        when(reviewerRepository.findMissedReviewsById(REVIEWER_ID)).thenReturn(4);
        OffsetDateTime before = OffsetDateTime.now();

        ReviewerPenaltyService.PenaltyApplication applied =
                reviewerPenaltyService.applyMissedReviewPenalty(assignment).orElseThrow();

        assertTrue(applied.escalated());
        ArgumentCaptor<OffsetDateTime> pausedUntil = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(reviewerRepository).pauseReviewingUntil(eq(REVIEWER_ID), pausedUntil.capture(), any());
        assertFalse(pausedUntil.getValue().isBefore(before.plusDays(14)));
        verify(xpLedgerGateway).recordXpTransaction(
                eq(REVIEWER_ID), eq(-100), eq(XpTransactionType.PENALTY), anyString(), isNull());
        verify(reviewerRepository, never()).banFromReviewing(any(), any());
    }

    @Test
    void tenthMissBansWithoutTouchingPauseTimestamp() {
        stubClaim(true);
        when(reviewerRepository.findMissedReviewsById(REVIEWER_ID)).thenReturn(10);

        reviewerPenaltyService.applyMissedReviewPenalty(assignment);

        verify(reviewerRepository).banFromReviewing(eq(REVIEWER_ID), any());
        verify(reviewerRepository, never()).pauseReviewingUntil(any(), any(), any());
        verify(xpLedgerGateway).recordXpTransaction(
                eq(REVIEWER_ID), eq(-500), eq(XpTransactionType.PENALTY), anyString(), isNull());
    }

    @Test
    void missingReviewerAfterClaimFails() {
        stubClaim(true);
        when(reviewerRepository.findMissedReviewsById(REVIEWER_ID)).thenReturn(null);

        assertThrows(IllegalStateException.class, () -> reviewerPenaltyService.applyMissedReviewPenalty(assignment));
    }

    private void stubClaim(boolean claimed) {
        when(xpLedgerGateway.hasTransaction(REVIEWER_ID, XpTransactionType.PENALTY, SUBMISSION_ID)).thenReturn(false);
        when(xpLedgerGateway.recordXpTransactionIfAbsent(
                eq(REVIEWER_ID), eq(-10), eq(XpTransactionType.PENALTY), anyString(), eq(SUBMISSION_ID)))
                .thenReturn(claimed ? Optional.of(new XpTransaction()) : Optional.empty());
    }
}
