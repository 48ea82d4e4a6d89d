package com.raffleapp.raffle.dto.payout.request;

import com.raffleapp.raffle.domain.treasury.PayoutStatus;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ListPayoutsRequest {
    // null lists every payout
    private PayoutStatus status;
}
