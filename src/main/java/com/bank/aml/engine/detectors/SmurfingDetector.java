package com.bank.aml.engine.detectors;

import com.bank.aml.engine.SignalTally;
import com.bank.aml.engine.TypologyDetector;
import com.bank.aml.model.AccountStats;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;
import org.springframework.stereotype.Component;

/**
 * Detects large sums split into many small deposits across many counterparties.
 * Activation floor 0.4.
 */
@Component
public class SmurfingDetector implements TypologyDetector {

    private static final double ACTIVATION_FLOOR = 0.4;

    @Override
    public Typology getTypology() {
        return Typology.SMURFING;
    }

    @Override
    public TypologyMatch detect(AdjudicationInput input) {
        AccountStats stats = input.getStats();
        double amount = input.getTransaction().getAmountSent();
        double ratio = stats.getSentToReceivedRatio();

        return new SignalTally(getTypology())
                .check(amount < 5000 && stats.getTransactionFrequencyPerDay() > 2,
                        "small_amount_high_frequency", 0.35)
                .check(stats.getUniqueCounterparties() > 20, "many_counterparties", 0.25)
                .check(input.getStatisticalScore() > 4.0, "statistical_anomaly", 0.15)
                .check(input.getNarrativeScore() < 0.5, "narrative_break", 0.15)
                .check(ratio >= 0.8 && ratio <= 1.2, "balanced_in_out", 0.1)
                .matchIfAtLeast(ACTIVATION_FLOOR);
    }
}
