package com.riskgate.backend.exception;

/**
 * Raised when a dependency's circuit breaker is open and the request fails fast.
 */
public class ServiceDegradedException extends RuntimeException {

    private final String dependency;

    public ServiceDegradedException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
