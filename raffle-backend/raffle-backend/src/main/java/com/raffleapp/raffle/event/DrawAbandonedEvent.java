package com.raffleapp.raffle.event;

public record DrawAbandonedEvent(long roundNumber, long numPlayers) {
}
