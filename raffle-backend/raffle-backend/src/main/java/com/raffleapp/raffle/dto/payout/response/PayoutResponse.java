package com.raffleapp.raffle.dto.payout.response;

import com.raffleapp.raffle.domain.treasury.PayoutStatus;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class PayoutResponse {
    private Long id;
    private long roundNumber;
    private String winner;
    private BigDecimal amount;
    private PayoutStatus status;
    private int attempts;
    private String transferReference;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
}
