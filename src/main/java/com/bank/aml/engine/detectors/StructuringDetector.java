package com.bank.aml.engine.detectors;

import com.bank.aml.engine.SignalTally;
import com.bank.aml.engine.TypologyDetector;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;
import org.springframework.stereotype.Component;

/**
 * Detects amounts kept just under reporting thresholds.
 *
 * Signals: amount in [9000, 10000) or [2700, 3000), statistical score above 5,
 * narrative coherence below 0.4, a round amount above 1000, and more than
 * three transactions a day. Emits when the weights sum to at least 0.4.
 *
 * Example: 9,800 sent by an account doing 4 txns/day with stat=7.5 and
 * narrative=0.25 sums to 0.4 + 0.2 + 0.2 + 0.1 + 0.15 = 1.05, clamped to 1.0.
 */
@Component
public class StructuringDetector implements TypologyDetector {

    private static final double ACTIVATION_FLOOR = 0.4;

    private static final double NEAR_10K_WEIGHT = 0.4;
    private static final double NEAR_3K_WEIGHT = 0.3;
    private static final double STATISTICAL_WEIGHT = 0.2;
    private static final double NARRATIVE_WEIGHT = 0.2;
    private static final double ROUND_AMOUNT_WEIGHT = 0.1;
    private static final double FREQUENCY_WEIGHT = 0.15;

    @Override
    public Typology getTypology() {
        return Typology.STRUCTURING;
    }

    @Override
    public TypologyMatch detect(AdjudicationInput input) {
        double amount = input.getTransaction().getAmountSent();

        return new SignalTally(getTypology())
                .check(amount >= 9000 && amount < 10000, "amount_near_10k_threshold", NEAR_10K_WEIGHT)
                .check(amount >= 2700 && amount < 3000, "amount_near_3k_threshold", NEAR_3K_WEIGHT)
                .check(input.getStatisticalScore() > 5.0, "high_statistical_anomaly", STATISTICAL_WEIGHT)
                .check(input.getNarrativeScore() < 0.4, "low_narrative_coherence", NARRATIVE_WEIGHT)
                .check(amount % 100 == 0 && amount > 1000, "round_number_amount", ROUND_AMOUNT_WEIGHT)
                .check(input.getStats().getTransactionFrequencyPerDay() > 3,
                        "high_transaction_frequency", FREQUENCY_WEIGHT)
                .matchIfAtLeast(ACTIVATION_FLOOR);
    }
}
