package com.raffleapp.raffle.event;

import java.math.BigDecimal;

public record EnteredRoundEvent(String identity, long roundNumber, int entryIndex, BigDecimal feePaid) {
}
