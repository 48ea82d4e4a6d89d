package com.raffleapp.raffle.domain.round;

import java.math.BigDecimal;

/**
 * Outcome of one eligibility evaluation, with every condition kept so a
 * rejected draw can report why.
 */
public record UpkeepDecision(
        boolean intervalElapsed,
        boolean open,
        boolean hasBalance,
        boolean hasPlayers,
        BigDecimal balance,
        long numPlayers,
        RoundPhase phase
) {
    public boolean upkeepNeeded() {
        return intervalElapsed && open && hasBalance && hasPlayers;
    }
}
