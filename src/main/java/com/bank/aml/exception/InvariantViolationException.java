package com.bank.aml.exception;

/**
 * Input or collaborator output outside its declared bounds. Raised before the
 * value can reach a decision.
 */
public class InvariantViolationException extends RuntimeException {

    private final String field;

    public InvariantViolationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
