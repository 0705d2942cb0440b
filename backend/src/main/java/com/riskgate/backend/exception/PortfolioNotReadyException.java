package com.riskgate.backend.exception;

public class PortfolioNotReadyException extends RuntimeException {

    public PortfolioNotReadyException(String message) {
        super(message);
    }

    public PortfolioNotReadyException(String message, Throwable cause) {
        super(message, cause);
    }
}
