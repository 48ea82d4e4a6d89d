package com.raffleapp.raffle.domain.round;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a draw may be requested. Pure: reads its inputs, never
 * mutates them.
 */
public final class EligibilityChecker {

    private final Duration interval;

    public EligibilityChecker(Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.interval = interval;
    }

    public boolean evaluate(Instant now, RaffleRound round, BigDecimal balance, long numPlayers) {
        return evaluateDetailed(now, round, balance, numPlayers).upkeepNeeded();
    }

    public UpkeepDecision evaluateDetailed(Instant now, RaffleRound round, BigDecimal balance, long numPlayers) {
        BigDecimal safeBalance = (balance == null) ? BigDecimal.ZERO : balance;

        // every condition is computed; none short-circuits the others
        boolean intervalElapsed = Duration.between(round.getLastDrawTimestamp(), now).compareTo(interval) >= 0;
        boolean open = round.isOpen();
        boolean hasBalance = safeBalance.signum() > 0;
        boolean hasPlayers = numPlayers > 0;

        return new UpkeepDecision(intervalElapsed, open, hasBalance, hasPlayers, safeBalance, numPlayers, round.getPhase());
    }
}
