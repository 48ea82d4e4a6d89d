package com.raffleapp.raffle.dto.oracle.response;

import com.raffleapp.raffle.domain.treasury.PayoutStatus;
import lombok.*;

import java.math.BigDecimal;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DrawOutcomeResponse {
    private String requestId;
    private long roundNumber;
    private String winner;
    private int winningIndex;
    private BigDecimal prize;
    private Long payoutId;
    private PayoutStatus payoutStatus;
}
