package com.raffleapp.raffle.event;

import java.math.BigDecimal;

public record PayoutFailedEvent(Long payoutId, String winner, BigDecimal amount, String reason) {
}
