package com.bank.aml.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Wire shape of the JSON object the reasoning service is asked to return.
 * Fields are nullable here; {@code ReasoningResponseParser} decides what is acceptable.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReasoningResponse {

    String decision;

    Double confidence;

    String typology;

    String reasoning;

    @JsonProperty("key_risk_factors")
    List<String> keyRiskFactors;

    @JsonProperty("regulatory_citations")
    List<String> regulatoryCitations;
}
