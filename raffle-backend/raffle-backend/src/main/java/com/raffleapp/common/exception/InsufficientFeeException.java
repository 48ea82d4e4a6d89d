package com.raffleapp.common.exception;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

public class InsufficientFeeException extends RaffleException {

    public InsufficientFeeException(BigDecimal feePaid, BigDecimal entranceFee) {
        super("Not enough paid to enter the raffle", "INSUFFICIENT_FEE", details(feePaid, entranceFee));
    }

    private static Map<String, Object> details(BigDecimal feePaid, BigDecimal entranceFee) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("feePaid", feePaid);
        details.put("entranceFee", entranceFee);
        return details;
    }
}
