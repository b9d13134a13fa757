package com.bank.aml.engine.detectors;

import com.bank.aml.engine.SignalTally;
import com.bank.aml.engine.TypologyDetector;
import com.bank.aml.model.AccountStats;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;
import org.springframework.stereotype.Component;

/**
 * Detects pass-through accounts: near-exact in/out balance, few counterparties,
 * or infrequent high-value movements. Activation floor 0.4.
 */
@Component
public class ShellCompanyDetector implements TypologyDetector {

    private static final double ACTIVATION_FLOOR = 0.4;

    @Override
    public Typology getTypology() {
        return Typology.SHELL_COMPANY;
    }

    @Override
    public TypologyMatch detect(AdjudicationInput input) {
        AccountStats stats = input.getStats();
        double ratio = stats.getSentToReceivedRatio();

        return new SignalTally(getTypology())
                .check(ratio >= 0.95 && ratio <= 1.05, "exact_passthrough", 0.35)
                .check(stats.getUniqueCounterparties() < 5 && stats.getTotalTransactions() > 20,
                        "limited_counterparties", 0.2)
                .check(stats.getAvgTransactionAmount() > 50000 && stats.getTransactionFrequencyPerDay() < 1,
                        "high_value_low_frequency", 0.25)
                .check(input.getStatisticalScore() > 5.0, "statistical_anomaly", 0.15)
                .matchIfAtLeast(ACTIVATION_FLOOR);
    }
}
