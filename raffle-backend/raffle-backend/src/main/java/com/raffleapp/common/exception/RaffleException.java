package com.raffleapp.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Base type for every typed failure the raffle reports to its callers.
 * Each subclass fixes its own errorCode; details carry the diagnostic payload.
 */
@Getter
public abstract class RaffleException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    protected RaffleException(String message, String errorCode, Map<String, Object> details) {
        this(message, errorCode, details, null);
    }

    protected RaffleException(String message, String errorCode, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = (details == null) ? Collections.emptyMap() : details;
    }
}
