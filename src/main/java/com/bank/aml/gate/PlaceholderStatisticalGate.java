package com.bank.aml.gate;

import com.bank.aml.config.TribunalConfig;
import com.bank.aml.model.AccountHistory;
import com.bank.aml.model.StatisticalGateResult;
import com.bank.aml.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Stand-in until the peer-group scorer is available. Always scores 0.0, so
 * every transaction passes the gate under the default threshold.
 */
@Component
public class PlaceholderStatisticalGate implements StatisticalGate {

    private final TribunalConfig config;

    public PlaceholderStatisticalGate(TribunalConfig config) {
        this.config = config;
    }

    @Override
    public StatisticalGateResult analyze(Transaction txn, AccountHistory history) {
        double score = 0.0;
        return StatisticalGateResult.builder()
                .score(score)
                .passed(score <= config.getThresholds().getStatisticalGate())
                .clusterId(history.getClusterId() != null ? history.getClusterId() : -1)
                .zScore(0.0)
                .details(Map.of("status", "not_implemented"))
                .build();
    }
}
