package com.raffleapp.common.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prize transfer to the winner failed. The round has already been reset;
 * the prize is parked on the payout record until it is retried.
 */
@Getter
public class PayoutFailedException extends RaffleException {

    private final Long payoutId;

    public PayoutFailedException(Long payoutId, String winner, BigDecimal amount, String reason) {
        super("Prize transfer failed", "PAYOUT_FAILED", details(payoutId, winner, amount, reason));
        this.payoutId = payoutId;
    }

    private static Map<String, Object> details(Long payoutId, String winner, BigDecimal amount, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("payoutId", payoutId);
        details.put("winner", winner);
        details.put("amount", amount);
        if (reason != null) details.put("reason", reason);
        return details;
    }
}
