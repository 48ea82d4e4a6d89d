package com.raffleapp.raffle.event;

import java.math.BigDecimal;

public record WinnerPickedEvent(String winner, long roundNumber, int winningIndex, BigDecimal prize) {
}
