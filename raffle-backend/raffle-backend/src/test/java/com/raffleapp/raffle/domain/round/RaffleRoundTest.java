package com.raffleapp.raffle.domain.round;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RaffleRoundTest {

    @Test
    void tokenIsOnlyRecordedWhileCalculating() {
        RaffleRound round = RaffleRound.builder().id(1L).lastDrawTimestamp(Instant.EPOCH).build();

        assertThrows(IllegalStateException.class, () -> round.recordPendingRequest("1"));

        round.beginCalculating();
        round.recordPendingRequest("1");

        assertTrue(round.matchesPendingRequest("1"));
        assertFalse(round.matchesPendingRequest("2"));
        assertFalse(round.matchesPendingRequest(null));
    }

    @Test
    void closingResetsAndAdvancesTheRound() {
        RaffleRound round = RaffleRound.builder().id(1L).lastDrawTimestamp(Instant.EPOCH).build();
        round.beginCalculating();
        round.recordPendingRequest("7");

        Instant drawnAt = Instant.parse("2026-01-01T00:01:00Z");
        round.closeWithWinner("alice", drawnAt);

        assertEquals(RoundPhase.OPEN, round.getPhase());
        assertNull(round.getPendingRequestToken());
        assertEquals("alice", round.getRecentWinner());
        assertEquals(drawnAt, round.getLastDrawTimestamp());
        assertEquals(2L, round.getRoundNumber());
        assertFalse(round.matchesPendingRequest("7"));
    }

    @Test
    void onlyACalculatingRoundWithoutTokenIsStalled() {
        Instant last = Instant.parse("2026-01-01T00:00:00Z");
        RaffleRound round = RaffleRound.builder().id(1L).lastDrawTimestamp(last).build();
        assertFalse(round.isDrawStalled());
        assertThrows(IllegalStateException.class, round::reopenStalledDraw);

        round.beginCalculating();
        assertTrue(round.isDrawStalled());
        round.reopenStalledDraw();

        assertEquals(RoundPhase.OPEN, round.getPhase());
        assertEquals(1L, round.getRoundNumber());
        assertEquals(last, round.getLastDrawTimestamp());

        round.beginCalculating();
        round.recordPendingRequest("3");
        assertFalse(round.isDrawStalled());
        assertThrows(IllegalStateException.class, round::reopenStalledDraw);
    }
}
