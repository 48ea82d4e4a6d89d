package com.raffleapp.raffle.domain.round;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EligibilityCheckerTest {

    static final Instant LAST_DRAW = Instant.parse("2026-01-01T00:00:00Z");
    static final Duration INTERVAL = Duration.ofSeconds(30);

    final EligibilityChecker checker = new EligibilityChecker(INTERVAL);

    static RaffleRound round(RoundPhase phase) {
        return RaffleRound.builder()
                .id(RaffleRound.SINGLETON_ID)
                .phase(phase)
                .lastDrawTimestamp(LAST_DRAW)
                .build();
    }

    @Test
    void allConditionsHold() {
        Instant now = LAST_DRAW.plus(INTERVAL).plusSeconds(1);
        assertTrue(checker.evaluate(now, round(RoundPhase.OPEN), new BigDecimal("0.01"), 1));
    }

    @Test
    void intervalBoundaryIsInclusive() {
        assertTrue(checker.evaluate(LAST_DRAW.plus(INTERVAL), round(RoundPhase.OPEN), BigDecimal.ONE, 1));
        assertFalse(checker.evaluate(LAST_DRAW.plus(INTERVAL).minusMillis(1), round(RoundPhase.OPEN), BigDecimal.ONE, 1));
    }

    @Test
    void eachConditionIsRequired() {
        Instant late = LAST_DRAW.plus(INTERVAL).plusSeconds(5);

        UpkeepDecision tooEarly = checker.evaluateDetailed(LAST_DRAW.plusSeconds(10), round(RoundPhase.OPEN), BigDecimal.ONE, 1);
        assertFalse(tooEarly.intervalElapsed());
        assertFalse(tooEarly.upkeepNeeded());

        UpkeepDecision calculating = checker.evaluateDetailed(late, round(RoundPhase.CALCULATING), BigDecimal.ONE, 1);
        assertFalse(calculating.open());
        assertFalse(calculating.upkeepNeeded());

        UpkeepDecision empty = checker.evaluateDetailed(late, round(RoundPhase.OPEN), BigDecimal.ZERO, 1);
        assertFalse(empty.hasBalance());
        assertFalse(empty.upkeepNeeded());

        UpkeepDecision nobody = checker.evaluateDetailed(late, round(RoundPhase.OPEN), BigDecimal.ONE, 0);
        assertFalse(nobody.hasPlayers());
        assertFalse(nobody.upkeepNeeded());
    }

    @Test
    void detailedDecisionReportsInputs() {
        UpkeepDecision decision = checker.evaluateDetailed(LAST_DRAW, round(RoundPhase.OPEN), null, 0);

        assertEquals(0, decision.balance().compareTo(BigDecimal.ZERO));
        assertEquals(0L, decision.numPlayers());
        assertEquals(RoundPhase.OPEN, decision.phase());
    }

    @Test
    void doesNotTouchTheRound() {
        RaffleRound round = round(RoundPhase.OPEN);
        checker.evaluate(LAST_DRAW.plusSeconds(60), round, BigDecimal.ONE, 3);

        assertEquals(RoundPhase.OPEN, round.getPhase());
        assertEquals(LAST_DRAW, round.getLastDrawTimestamp());
        assertNull(round.getPendingRequestToken());
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new EligibilityChecker(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new EligibilityChecker(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> new EligibilityChecker(null));
    }
}
