package com.raffleapp.raffle.domain.round;

import com.raffleapp.raffle.domain.treasury.PayoutStatus;

import java.math.BigDecimal;

public record DrawOutcome(
        String requestToken,
        long roundNumber,
        String winner,
        int winningIndex,
        BigDecimal prize,
        Long payoutId,
        PayoutStatus payoutStatus
) {
}
