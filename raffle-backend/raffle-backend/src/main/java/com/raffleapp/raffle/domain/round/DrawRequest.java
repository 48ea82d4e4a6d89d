package com.raffleapp.raffle.domain.round;

/** A randomness request accepted by the oracle for the given round. */
public record DrawRequest(String requestToken, long roundNumber) {
}
