package com.raffleapp.raffle.keeper;

import com.raffleapp.common.exception.UpkeepNotNeededException;
import com.raffleapp.raffle.domain.round.DrawRequest;
import com.raffleapp.raffle.domain.round.RoundPhase;
import com.raffleapp.raffle.domain.round.UpkeepDecision;
import com.raffleapp.raffle.service.RandomnessRequesterService;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

class KeeperSchedulerTest {

    static final Instant NOW = Instant.parse("2026-01-01T00:00:40Z");

    final RandomnessRequesterService requester = mock(RandomnessRequesterService.class);
    final KeeperScheduler keeper = new KeeperScheduler(requester, Clock.fixed(NOW, ZoneOffset.UTC));

    static UpkeepDecision decision(boolean needed) {
        return new UpkeepDecision(needed, true, true, true, BigDecimal.ONE, 1, RoundPhase.OPEN);
    }

    @Test
    void performsWhenUpkeepIsNeeded() {
        when(requester.checkUpkeep(NOW)).thenReturn(decision(true));
        when(requester.requestDraw(NOW)).thenReturn(new DrawRequest("1", 1L));

        keeper.poll();

        verify(requester).requestDraw(NOW);
    }

    @Test
    void skipsWhenNotNeeded() {
        when(requester.checkUpkeep(NOW)).thenReturn(decision(false));

        keeper.poll();

        verify(requester, never()).requestDraw(any());
    }

    @Test
    void raceWithAnotherKeeperIsTolerated() {
        when(requester.checkUpkeep(NOW)).thenReturn(decision(true));
        when(requester.requestDraw(NOW)).thenThrow(new UpkeepNotNeededException(BigDecimal.ONE, 1, RoundPhase.CALCULATING));

        assertDoesNotThrow(keeper::poll);
    }
}
