package com.bank.aml.engine.detectors;

import com.bank.aml.engine.SignalTally;
import com.bank.aml.engine.TypologyDetector;
import com.bank.aml.model.AccountStats;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;
import org.springframework.stereotype.Component;

/**
 * Detects rapid movement of funds through an account to obscure their origin:
 * very high frequency and volume with money in roughly equal to money out.
 * Activation floor 0.5.
 */
@Component
public class LayeringDetector implements TypologyDetector {

    private static final double ACTIVATION_FLOOR = 0.5;

    @Override
    public Typology getTypology() {
        return Typology.LAYERING;
    }

    @Override
    public TypologyMatch detect(AdjudicationInput input) {
        AccountStats stats = input.getStats();
        double ratio = stats.getSentToReceivedRatio();

        return new SignalTally(getTypology())
                .check(stats.getTransactionFrequencyPerDay() > 5, "very_high_frequency", 0.3)
                .check(stats.getTotalTransactions() > 100, "high_transaction_count", 0.2)
                .check(ratio >= 0.9 && ratio <= 1.1, "in_equals_out", 0.25)
                .check(input.getStatisticalScore() > 6.0, "high_statistical_anomaly", 0.15)
                .check(input.getNarrativeScore() < 0.3, "very_low_coherence", 0.2)
                .matchIfAtLeast(ACTIVATION_FLOOR);
    }
}
