package com.raffleapp.raffle.domain.round;

public enum RoundPhase {
    OPEN,
    CALCULATING
}
