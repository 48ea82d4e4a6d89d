package com.raffleapp.common.http;

import lombok.Getter;

@Getter
public class JsonHttpException extends RuntimeException {

    private final int statusCode;

    public JsonHttpException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
