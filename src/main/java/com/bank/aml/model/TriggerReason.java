package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which gate(s) failed and caused escalation to adjudication.
 */
public enum TriggerReason {
    STATISTICAL("statistical"),
    NARRATIVE("narrative"),
    BOTH("both");

    private final String label;

    TriggerReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Attribute an escalation to the failed gate(s).
     *
     * @throws IllegalArgumentException when both gates passed (nothing to escalate)
     */
    public static TriggerReason attribute(boolean statisticalPassed, boolean narrativePassed) {
        if (!statisticalPassed && !narrativePassed) return BOTH;
        if (!statisticalPassed) return STATISTICAL;
        if (!narrativePassed) return NARRATIVE;
        throw new IllegalArgumentException("No gate failed; transaction is not eligible for adjudication");
    }
}
