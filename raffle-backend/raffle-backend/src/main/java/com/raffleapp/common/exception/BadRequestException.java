package com.raffleapp.common.exception;

import java.util.Map;

public class BadRequestException extends RaffleException {

    public BadRequestException(String message) {
        this(message, null);
    }

    public BadRequestException(String message, Map<String, Object> details) {
        super(message, "BAD_REQUEST", details);
    }
}
