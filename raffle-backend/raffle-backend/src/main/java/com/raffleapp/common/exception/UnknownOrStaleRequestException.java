package com.raffleapp.common.exception;

import java.util.LinkedHashMap;
import java.util.Map;

public class UnknownOrStaleRequestException extends RaffleException {

    public UnknownOrStaleRequestException(String requestId) {
        super("Fulfillment does not match the outstanding randomness request", "UNKNOWN_OR_STALE_REQUEST", details(requestId));
    }

    private static Map<String, Object> details(String requestId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestId", requestId);
        return details;
    }
}
