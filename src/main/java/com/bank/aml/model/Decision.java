package com.bank.aml.model;

public enum Decision {
    BLOCK,
    APPROVE,
    REVIEW;

    public boolean requiresReport() {
        return this == BLOCK || this == REVIEW;
    }
}
