package com.raffleapp.common.exception;

import com.raffleapp.raffle.domain.round.RoundPhase;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a draw is abandoned while the round is open or still waiting on
 * an accepted oracle request.
 */
public class DrawNotStalledException extends RaffleException {

    public DrawNotStalledException(RoundPhase phase, boolean requestOutstanding) {
        super("No stalled draw to abandon", "DRAW_NOT_STALLED", details(phase, requestOutstanding));
    }

    private static Map<String, Object> details(RoundPhase phase, boolean requestOutstanding) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("phase", phase.name());
        details.put("requestOutstanding", requestOutstanding);
        return details;
    }
}
