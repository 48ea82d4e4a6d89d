package com.raffleapp.common.exception;

import com.raffleapp.raffle.domain.round.RoundPhase;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a draw is requested while the round is not eligible for one.
 * Not transient: the keeper should poll again once conditions change.
 */
@Getter
public class UpkeepNotNeededException extends RaffleException {

    private final BigDecimal balance;
    private final long numPlayers;
    private final RoundPhase phase;

    public UpkeepNotNeededException(BigDecimal balance, long numPlayers, RoundPhase phase) {
        super("Upkeep not needed", "UPKEEP_NOT_NEEDED", details(balance, numPlayers, phase));
        this.balance = balance;
        this.numPlayers = numPlayers;
        this.phase = phase;
    }

    private static Map<String, Object> details(BigDecimal balance, long numPlayers, RoundPhase phase) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("balance", balance);
        details.put("numPlayers", numPlayers);
        details.put("phase", phase.name());
        return details;
    }
}
