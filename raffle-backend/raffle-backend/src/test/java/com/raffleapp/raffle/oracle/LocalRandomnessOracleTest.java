package com.raffleapp.raffle.oracle;

import com.raffleapp.common.exception.BadRequestException;
import com.raffleapp.common.exception.NotFoundException;
import com.raffleapp.common.exception.PayoutFailedException;
import com.raffleapp.common.exception.UnknownOrStaleRequestException;
import com.raffleapp.raffle.config.RaffleProperties;
import com.raffleapp.raffle.domain.round.DrawOutcome;
import com.raffleapp.raffle.domain.treasury.PayoutStatus;
import com.raffleapp.raffle.oracle.RandomnessOracleClient.OracleRequest;
import com.raffleapp.raffle.service.WinnerResolverService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LocalRandomnessOracleTest {

    static final OracleRequest REQUEST = new OracleRequest("0xlane", 0, 3, 500_000, 1);
    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    WinnerResolverService resolver;
    TaskScheduler scheduler;
    RaffleProperties properties;

    @BeforeEach
    void setUp() {
        resolver = mock(WinnerResolverService.class);
        scheduler = mock(TaskScheduler.class);
        properties = new RaffleProperties();
    }

    private LocalRandomnessOracle oracle() {
        return new LocalRandomnessOracle(resolver, scheduler, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void requestIdsAreSequential() {
        properties.getOracle().getLocal().setAutoFulfill(false);
        LocalRandomnessOracle oracle = oracle();

        assertEquals("1", oracle.submitRequest(REQUEST));
        assertEquals("2", oracle.submitRequest(REQUEST));
        assertEquals(2, oracle.pendingRequestIds().size());
        verifyNoInteractions(scheduler);
    }

    @Test
    void fulfillNowDeliversWordsOnce() {
        properties.getOracle().getLocal().setAutoFulfill(false);
        LocalRandomnessOracle oracle = oracle();
        String id = oracle.submitRequest(REQUEST);
        List<BigInteger> words = List.of(BigInteger.TEN);

        oracle.fulfillNow(id, words);

        verify(resolver).fulfill(id, words, NOW);
        assertTrue(oracle.pendingRequestIds().isEmpty());
        assertThrows(NotFoundException.class, () -> oracle.fulfillNow(id, words));
        assertThrows(NotFoundException.class, () -> oracle.fulfillNow("99"));
    }

    @Test
    void refusedWordsLeaveRequestPending() {
        properties.getOracle().getLocal().setAutoFulfill(false);
        LocalRandomnessOracle oracle = oracle();
        String id = oracle.submitRequest(REQUEST);
        List<BigInteger> negative = List.of(BigInteger.valueOf(-1));
        List<BigInteger> good = List.of(BigInteger.TWO);
        when(resolver.fulfill(id, negative, NOW)).thenThrow(new BadRequestException("randomWords must be non-negative"));

        assertThrows(BadRequestException.class, () -> oracle.fulfillNow(id, negative));
        assertTrue(oracle.pendingRequestIds().contains(id));

        oracle.fulfillNow(id, good);
        verify(resolver).fulfill(id, good, NOW);
        assertFalse(oracle.pendingRequestIds().contains(id));
    }

    @Test
    void failureBeforeApplyingLeavesRequestPending() {
        properties.getOracle().getLocal().setAutoFulfill(false);
        LocalRandomnessOracle oracle = oracle();
        String id = oracle.submitRequest(REQUEST);
        when(resolver.fulfill(eq(id), anyList(), any())).thenThrow(new IllegalStateException("connection reset"));

        assertThrows(IllegalStateException.class, () -> oracle.fulfillNow(id));
        assertTrue(oracle.pendingRequestIds().contains(id));
    }

    @Test
    void appliedOrStaleRequestsAreDropped() {
        properties.getOracle().getLocal().setAutoFulfill(false);
        LocalRandomnessOracle oracle = oracle();
        String unpaid = oracle.submitRequest(REQUEST);
        String stale = oracle.submitRequest(REQUEST);
        when(resolver.fulfill(eq(unpaid), anyList(), any()))
                .thenThrow(new PayoutFailedException(1L, "alice", BigDecimal.ONE, "recipient rejected transfer"));
        when(resolver.fulfill(eq(stale), anyList(), any())).thenThrow(new UnknownOrStaleRequestException(stale));

        assertThrows(PayoutFailedException.class, () -> oracle.fulfillNow(unpaid));
        assertThrows(UnknownOrStaleRequestException.class, () -> oracle.fulfillNow(stale));

        assertTrue(oracle.pendingRequestIds().isEmpty());
        assertThrows(NotFoundException.class, () -> oracle.fulfillNow(null));
    }

    @Test
    void generatedWordsMatchRequestedCount() {
        properties.getOracle().getLocal().setAutoFulfill(false);
        LocalRandomnessOracle oracle = oracle();
        String id = oracle.submitRequest(new OracleRequest("0xlane", 0, 3, 500_000, 2));

        oracle.fulfillNow(id);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<BigInteger>> words = ArgumentCaptor.forClass(List.class);
        verify(resolver).fulfill(eq(id), words.capture(), eq(NOW));
        assertEquals(2, words.getValue().size());
        words.getValue().forEach(w -> assertTrue(w.signum() >= 0 && w.bitLength() <= 256));
    }

    @Test
    void autoFulfillIsScheduledAfterConfirmations() {
        when(resolver.fulfill(anyString(), anyList(), any()))
                .thenReturn(new DrawOutcome("1", 1L, "alice", 0, BigDecimal.ONE, 1L, PayoutStatus.PAID));
        LocalRandomnessOracle oracle = oracle();
        Instant before = Instant.now();

        String id = oracle.submitRequest(REQUEST);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(scheduler).schedule(task.capture(), at.capture());
        assertFalse(at.getValue().isBefore(before.plusSeconds(3)));

        task.getValue().run();
        verify(resolver).fulfill(eq(id), anyList(), eq(NOW));

        // a second firing finds nothing pending and is ignored
        task.getValue().run();
        verify(resolver, times(1)).fulfill(anyString(), anyList(), any());
    }

    @Test
    void rejectedAutoFulfillIsLoggedNotThrown() {
        when(resolver.fulfill(anyString(), anyList(), any())).thenThrow(new UnknownOrStaleRequestException("1"));
        LocalRandomnessOracle oracle = oracle();
        oracle.submitRequest(REQUEST);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), any(Instant.class));

        assertDoesNotThrow(() -> task.getValue().run());
    }
}
