package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineLayer {
    STATISTICAL("statistical"),
    NARRATIVE("narrative"),
    EXPERT("expert");

    private final String label;

    PipelineLayer(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
