package com.raffleapp.raffle.dto.oracle.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.math.BigInteger;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FulfillRandomWordsRequest {
    @NotBlank private String requestId;
    @NotEmpty private List<BigInteger> randomWords;
}
