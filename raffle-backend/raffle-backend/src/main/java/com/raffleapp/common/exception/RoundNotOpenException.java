package com.raffleapp.common.exception;

import com.raffleapp.raffle.domain.round.RoundPhase;

import java.util.Map;

public class RoundNotOpenException extends RaffleException {

    public RoundNotOpenException(RoundPhase phase) {
        super("Raffle round is not open", "ROUND_NOT_OPEN", Map.of("phase", phase.name()));
    }
}
