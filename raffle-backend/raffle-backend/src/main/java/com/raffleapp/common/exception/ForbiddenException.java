package com.raffleapp.common.exception;

public class ForbiddenException extends RaffleException {

    public ForbiddenException(String message) {
        super(message, "FORBIDDEN", null);
    }
}
