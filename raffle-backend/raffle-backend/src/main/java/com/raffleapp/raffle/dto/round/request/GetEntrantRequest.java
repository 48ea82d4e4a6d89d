package com.raffleapp.raffle.dto.round.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GetEntrantRequest {
    @NotNull @Min(0) private Integer index;
}
