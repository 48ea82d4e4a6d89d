package com.raffleapp.common.exception;

import java.util.Map;

public class NotFoundException extends RaffleException {

    public NotFoundException(String message) {
        this(message, null);
    }

    public NotFoundException(String message, Map<String, Object> details) {
        super(message, "NOT_FOUND", details);
    }
}
