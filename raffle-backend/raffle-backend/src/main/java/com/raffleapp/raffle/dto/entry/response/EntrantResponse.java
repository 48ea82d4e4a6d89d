package com.raffleapp.raffle.dto.entry.response;

import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EntrantResponse {
    private int index;
    private String identity;
    private BigDecimal feePaid;
    private long roundNumber;
    private Instant enteredAt;
}
