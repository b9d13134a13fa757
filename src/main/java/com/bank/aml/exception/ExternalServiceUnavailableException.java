package com.bank.aml.exception;

/**
 * A collaborator the tribunal depends on (gate, knowledge base, reasoning service)
 * could not be reached or did not answer in time. Never converted into a decision.
 */
public class ExternalServiceUnavailableException extends RuntimeException {

    private final String service;

    public ExternalServiceUnavailableException(String service, String message, Throwable cause) {
        super(service + " unavailable: " + message, cause);
        this.service = service;
    }

    public ExternalServiceUnavailableException(String service, String message) {
        this(service, message, null);
    }

    public String getService() {
        return service;
    }
}
