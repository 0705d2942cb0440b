package com.riskgate.backend.exception;

public class ExchangeApiException extends RuntimeException {

    private final int statusCode;

    public ExchangeApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public ExchangeApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public ExchangeApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
