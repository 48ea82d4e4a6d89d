package com.raffleapp.raffle.dto.round.response;

import com.raffleapp.raffle.domain.round.RoundPhase;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RoundStateResponse {
    private long roundNumber;
    private RoundPhase phase;
    private BigDecimal entranceFee;
    private long intervalSeconds;
    private Instant lastDrawTimestamp;
    private long numberOfPlayers;
    private BigDecimal balance;
    private String recentWinner;
    private boolean drawPending;
    private boolean drawStalled;
    private int requestConfirmations;
    private int numWords;
}
