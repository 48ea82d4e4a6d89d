package com.raffleapp.raffle.domain.treasury;

public enum PayoutStatus {
    PENDING,
    PAID,
    FAILED
}
