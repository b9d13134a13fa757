package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendedAction {
    FILE_SAR("file_sar"),
    ENHANCED_MONITORING("enhanced_monitoring"),
    ESCALATE_TO_COMPLIANCE("escalate_to_compliance");

    private final String label;

    RecommendedAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
