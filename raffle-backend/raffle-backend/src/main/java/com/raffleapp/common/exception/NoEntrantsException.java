package com.raffleapp.common.exception;

import java.util.Map;

public class NoEntrantsException extends RaffleException {

    public NoEntrantsException(String requestId) {
        super("No entrants to draw a winner from", "NO_ENTRANTS", Map.of("requestId", requestId));
    }
}
