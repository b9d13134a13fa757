package com.bank.aml.service;

import com.bank.aml.model.Decision;
import com.bank.aml.model.ReasoningOutcome;
import com.bank.aml.model.ReasoningResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decodes the reasoning service's free-form reply into a {@link ReasoningOutcome}.
 *
 * The JSON object is taken from the first '{' to the last '}'. It must carry a
 * decision (BLOCK, APPROVE or REVIEW, any case) and a confidence within [0, 1];
 * anything else is MALFORMED.
 */
@Component
public class ReasoningResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ReasoningResponseParser.class);

    private final ObjectMapper objectMapper;

    public ReasoningResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReasoningOutcome parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return malformed(raw, "empty response");
        }

        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return malformed(raw, "no JSON object");
        }

        ReasoningResponse response;
        try {
            response = objectMapper.readValue(raw.substring(start, end + 1), ReasoningResponse.class);
        } catch (JsonProcessingException e) {
            return malformed(raw, e.getOriginalMessage());
        }

        if (response.getDecision() == null) {
            return malformed(raw, "missing decision");
        }
        Decision decision;
        try {
            decision = Decision.valueOf(response.getDecision().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return malformed(raw, "unknown decision '" + response.getDecision() + "'");
        }

        Double confidence = response.getConfidence();
        if (confidence == null) {
            return malformed(raw, "missing confidence");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            return malformed(raw, "confidence out of range: " + confidence);
        }

        return ReasoningOutcome.parsed(decision, confidence, response.getTypology(), response.getReasoning(),
                response.getKeyRiskFactors(), response.getRegulatoryCitations(), raw);
    }

    private ReasoningOutcome malformed(String raw, String reason) {
        log.debug("Reasoning response rejected: {}", reason);
        return ReasoningOutcome.malformed(raw);
    }
}
