package com.raffleapp.raffle.dto.upkeep.response;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DrawRequestedResponse {
    private String requestId;
    private long roundNumber;
}
