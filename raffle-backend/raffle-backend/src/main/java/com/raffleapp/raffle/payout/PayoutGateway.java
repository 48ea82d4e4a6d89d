package com.raffleapp.raffle.payout;

import java.math.BigDecimal;

/**
 * Moves prize funds out of the raffle to a winner. A transfer either moves the
 * whole amount or nothing.
 */
public interface PayoutGateway {

    TransferResult transfer(String identity, BigDecimal amount, String reference);

    record TransferResult(boolean succeeded, String transferReference, String failureReason) {

        public static TransferResult success(String transferReference) {
            return new TransferResult(true, transferReference, null);
        }

        public static TransferResult failure(String failureReason) {
            return new TransferResult(false, null, failureReason);
        }
    }
}
