package com.bank.aml.gate;

import com.bank.aml.config.TribunalConfig;
import com.bank.aml.model.AccountHistory;
import com.bank.aml.model.NarrativeGateResult;
import com.bank.aml.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Stand-in until the embedding-based coherence scorer is available.
 * Always scores 1.0 (fully coherent).
 */
@Component
public class PlaceholderNarrativeGate implements NarrativeGate {

    private final TribunalConfig config;

    public PlaceholderNarrativeGate(TribunalConfig config) {
        this.config = config;
    }

    @Override
    public NarrativeGateResult analyze(Transaction txn, AccountHistory history) {
        double score = 1.0;
        return NarrativeGateResult.builder()
                .score(score)
                .passed(score >= config.getThresholds().getNarrativeGate())
                .details(Map.of("status", "not_implemented"))
                .build();
    }
}
