package com.raffleapp.common.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The oracle did not accept a randomness request. The round stays CALCULATING;
 * recovering it is left to the operator.
 */
public class OracleRequestFailedException extends RaffleException {

    public OracleRequestFailedException(long roundNumber, Throwable cause) {
        super("Randomness request was not accepted by the oracle", "ORACLE_REQUEST_FAILED", details(roundNumber, cause), cause);
    }

    private static Map<String, Object> details(long roundNumber, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roundNumber", roundNumber);
        details.put("reason", cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
        return details;
    }
}
