package com.raffleapp.raffle.service;

import com.raffleapp.common.exception.DrawNotStalledException;
import com.raffleapp.common.exception.OracleRequestFailedException;
import com.raffleapp.common.exception.UpkeepNotNeededException;
import com.raffleapp.raffle.config.RaffleProperties;
import com.raffleapp.raffle.domain.round.DrawRequest;
import com.raffleapp.raffle.domain.round.EligibilityChecker;
import com.raffleapp.raffle.domain.round.RaffleRound;
import com.raffleapp.raffle.domain.round.UpkeepDecision;
import com.raffleapp.raffle.event.DrawAbandonedEvent;
import com.raffleapp.raffle.event.DrawRequestedEvent;
import com.raffleapp.raffle.oracle.RandomnessOracleClient;
import com.raffleapp.raffle.oracle.RandomnessOracleClient.OracleRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Closes the open round to entries and asks the oracle for one random word.
 * At most one request is outstanding: the round leaves OPEN before the oracle
 * is called and only the matching fulfillment reopens it.
 */
@Slf4j
@Service
public class RandomnessRequesterService {

    private final RoundGuard guard;
    private final RoundStateService rounds;
    private final PlayerRegistryService registry;
    private final TreasuryService treasury;
    private final EligibilityChecker eligibility;
    private final RandomnessOracleClient oracle;
    private final RaffleProperties properties;
    private final ApplicationEventPublisher events;

    public RandomnessRequesterService(
            RoundGuard guard,
            RoundStateService rounds,
            PlayerRegistryService registry,
            TreasuryService treasury,
            EligibilityChecker eligibility,
            RandomnessOracleClient oracle,
            RaffleProperties properties,
            ApplicationEventPublisher events
    ) {
        this.guard = guard;
        this.rounds = rounds;
        this.registry = registry;
        this.treasury = treasury;
        this.eligibility = eligibility;
        this.oracle = oracle;
        this.properties = properties;
        this.events = events;
    }

    public UpkeepDecision checkUpkeep(Instant now) {
        return guard.read(() -> evaluate(now, rounds.requireRound()));
    }

    /**
     * @throws UpkeepNotNeededException     when the round is not eligible; nothing changes
     * @throws OracleRequestFailedException when the oracle rejects the request; the round
     *                                      stays CALCULATING without a request token until
     *                                      {@link #abandonStalledDraw()} reopens it
     */
    public DrawRequest requestDraw(Instant now) {
        return guard.exclusive(() -> {
            long roundNumber = guard.write(() -> {
                RaffleRound round = rounds.requireRound();
                UpkeepDecision decision = evaluate(now, round);
                if (!decision.upkeepNeeded()) {
                    throw new UpkeepNotNeededException(decision.balance(), decision.numPlayers(), decision.phase());
                }
                round.beginCalculating();
                rounds.save(round);
                return round.getRoundNumber();
            });

            RaffleProperties.Oracle cfg = properties.getOracle();
            OracleRequest request = new OracleRequest(
                    cfg.getGasLane(),
                    cfg.getSubscriptionId(),
                    RaffleProperties.REQUEST_CONFIRMATIONS,
                    cfg.getCallbackGasLimit(),
                    RaffleProperties.NUM_WORDS
            );

            String token;
            try {
                token = oracle.submitRequest(request);
            } catch (RuntimeException e) {
                log.error("Randomness request for round {} failed; round left CALCULATING", roundNumber, e);
                throw new OracleRequestFailedException(roundNumber, e);
            }
            if (token == null || token.isBlank()) {
                log.error("Oracle returned no request id for round {}; round left CALCULATING", roundNumber);
                throw new OracleRequestFailedException(roundNumber, new IllegalStateException("oracle returned no request id"));
            }

            guard.write(() -> {
                RaffleRound round = rounds.requireRound();
                round.recordPendingRequest(token);
                return rounds.save(round);
            });

            events.publishEvent(new DrawRequestedEvent(token, roundNumber));
            return new DrawRequest(token, roundNumber);
        });
    }

    /**
     * Reopens a round whose draw request never reached the oracle, so entries
     * resume and the keeper can request again. Entrants and balance are kept.
     *
     * @throws DrawNotStalledException when the round is OPEN or an oracle request is outstanding
     */
    public RaffleRound abandonStalledDraw() {
        RaffleRound reopened = guard.write(() -> {
            RaffleRound round = rounds.requireRound();
            if (!round.isDrawStalled()) {
                throw new DrawNotStalledException(round.getPhase(), round.getPendingRequestToken() != null);
            }
            round.reopenStalledDraw();
            return rounds.save(round);
        });

        long numPlayers = guard.read(() -> registry.count(reopened.getRoundNumber()));
        log.warn("Stalled draw for round {} abandoned; round reopened with {} players", reopened.getRoundNumber(), numPlayers);
        events.publishEvent(new DrawAbandonedEvent(reopened.getRoundNumber(), numPlayers));
        return reopened;
    }

    private UpkeepDecision evaluate(Instant now, RaffleRound round) {
        return eligibility.evaluateDetailed(now, round, treasury.balance(), registry.count(round.getRoundNumber()));
    }
}
