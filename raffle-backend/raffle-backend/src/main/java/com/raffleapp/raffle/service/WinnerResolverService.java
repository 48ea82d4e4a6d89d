package com.raffleapp.raffle.service;

import com.raffleapp.common.exception.BadRequestException;
import com.raffleapp.common.exception.NoEntrantsException;
import com.raffleapp.common.exception.PayoutFailedException;
import com.raffleapp.common.exception.UnknownOrStaleRequestException;
import com.raffleapp.raffle.domain.round.DrawOutcome;
import com.raffleapp.raffle.domain.round.Entrant;
import com.raffleapp.raffle.domain.round.RaffleRound;
import com.raffleapp.raffle.domain.treasury.PrizePayout;
import com.raffleapp.raffle.event.WinnerPickedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Applies an oracle fulfillment to the round it was requested for.
 * <p>
 * Bookkeeping (winner record, phase, token, entrants, timestamp, treasury)
 * commits in one transaction before any money moves. A failed transfer does
 * not undo the reset; the prize stays on a FAILED payout until retried.
 */
@Slf4j
@Service
public class WinnerResolverService {

    private final RoundGuard guard;
    private final RoundStateService rounds;
    private final PlayerRegistryService registry;
    private final TreasuryService treasury;
    private final ApplicationEventPublisher events;

    public WinnerResolverService(
            RoundGuard guard,
            RoundStateService rounds,
            PlayerRegistryService registry,
            TreasuryService treasury,
            ApplicationEventPublisher events
    ) {
        this.guard = guard;
        this.rounds = rounds;
        this.registry = registry;
        this.treasury = treasury;
        this.events = events;
    }

    /**
     * @throws UnknownOrStaleRequestException when {@code requestToken} is not the pending request
     * @throws NoEntrantsException            when the round has nobody to draw from
     * @throws PayoutFailedException          when the winner could not be paid; the round is already reset
     */
    public DrawOutcome fulfill(String requestToken, List<BigInteger> randomWords, Instant now) {
        if (randomWords == null || randomWords.isEmpty() || randomWords.get(0) == null) {
            throw new BadRequestException("randomWords must contain at least one value");
        }
        BigInteger randomValue = randomWords.get(0);
        if (randomValue.signum() < 0) {
            throw new BadRequestException("randomWords must be non-negative");
        }

        return guard.exclusive(() -> {
            Resolution resolution = guard.write(() -> {
                RaffleRound round = rounds.requireRound();
                if (requestToken == null || !round.matchesPendingRequest(requestToken)) {
                    log.warn("Rejected fulfillment for request {} (round {} phase {})",
                            requestToken, round.getRoundNumber(), round.getPhase());
                    throw new UnknownOrStaleRequestException(requestToken);
                }

                long closingRound = round.getRoundNumber();
                List<Entrant> entrants = registry.entrants(closingRound);
                if (entrants.isEmpty()) {
                    throw new NoEntrantsException(requestToken);
                }

                int winningIndex = randomValue.mod(BigInteger.valueOf(entrants.size())).intValueExact();
                Entrant winner = entrants.get(winningIndex);

                round.closeWithWinner(winner.getIdentity(), now);
                rounds.save(round);
                registry.clear(closingRound);
                PrizePayout payout = treasury.openPayout(closingRound, requestToken, winner.getIdentity());

                return new Resolution(closingRound, winningIndex, payout);
            });

            PrizePayout opened = resolution.payout();
            events.publishEvent(new WinnerPickedEvent(opened.getWinner(), resolution.roundNumber(), resolution.winningIndex(), opened.getAmount()));

            PrizePayout settled = treasury.settle(opened.getId());
            return new DrawOutcome(
                    requestToken,
                    resolution.roundNumber(),
                    settled.getWinner(),
                    resolution.winningIndex(),
                    settled.getAmount(),
                    settled.getId(),
                    settled.getStatus()
            );
        });
    }

    private record Resolution(long roundNumber, int winningIndex, PrizePayout payout) {}
}
