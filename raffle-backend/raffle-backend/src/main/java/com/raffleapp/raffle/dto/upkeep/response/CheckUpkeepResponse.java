package com.raffleapp.raffle.dto.upkeep.response;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CheckUpkeepResponse {
    private boolean upkeepNeeded;
    // opaque to the keeper; always "0x"
    private String performData;
}
