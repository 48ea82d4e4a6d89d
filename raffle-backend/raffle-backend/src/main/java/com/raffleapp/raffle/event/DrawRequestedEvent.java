package com.raffleapp.raffle.event;

public record DrawRequestedEvent(String requestToken, long roundNumber) {
}
