package com.raffleapp.raffle.dto.payout.request;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RetryPayoutRequest {
    @NotNull private Long payoutId;
}
