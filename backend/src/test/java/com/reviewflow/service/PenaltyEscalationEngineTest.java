package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PenaltyEscalationEngineTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 4, 1, 8, 0, 0, 0, ZoneOffset.UTC);

    private final PenaltyEscalationEngine engine = new PenaltyEscalationEngine(new ReviewflowProperties());

    @Test
    void fourthMissPausesForTwoWeeks() {
        PenaltyEscalationEngine.EscalationDecision decision = engine.evaluate(4, NOW).orElseThrow();

        assertFalse(decision.permanentBan());
        assertEquals(NOW.plusDays(14), decision.pausedUntil());
        assertEquals(-100, decision.xpDelta());
        assertTrue(decision.description().startsWith("First strike"));
    }

    @Test
    void seventhMissPausesForFourWeeks() {
        PenaltyEscalationEngine.EscalationDecision decision = engine.evaluate(7, NOW).orElseThrow();

        assertFalse(decision.permanentBan());
        assertEquals(NOW.plusDays(28), decision.pausedUntil());
        assertEquals(-200, decision.xpDelta());
    }

    @Test
    void tenthMissBansWithoutPauseTimestamp() {
        PenaltyEscalationEngine.EscalationDecision decision = engine.evaluate(10, NOW).orElseThrow();

        assertTrue(decision.permanentBan());
        assertNull(decision.pausedUntil());
        assertEquals(-500, decision.xpDelta());
    }

    @Test
    void countsBetweenAndBeyondThresholdsDoNothing() {
        for (int missed : new int[]{0, 1, 2, 3, 5, 6, 8, 9, 11, 12, 40}) {
            Optional<PenaltyEscalationEngine.EscalationDecision> decision = engine.evaluate(missed, NOW);
            assertTrue(decision.isEmpty(), "expected no escalation at " + missed);
        }
    }
}
