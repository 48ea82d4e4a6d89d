package com.raffleapp.raffle.dto.entry.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EnterRaffleRequest {
    @NotBlank @Size(max = 128) private String identity;
    @NotNull @DecimalMin("0") @Digits(integer = 20, fraction = 18) private BigDecimal feePaid;
}
