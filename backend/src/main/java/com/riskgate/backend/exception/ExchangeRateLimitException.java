package com.riskgate.backend.exception;

public class ExchangeRateLimitException extends ExchangeApiException {

    public ExchangeRateLimitException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
