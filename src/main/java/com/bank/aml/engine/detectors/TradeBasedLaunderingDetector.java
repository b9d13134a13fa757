package com.bank.aml.engine.detectors;

import com.bank.aml.engine.SignalTally;
import com.bank.aml.engine.TypologyDetector;
import com.bank.aml.model.AccountStats;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;
import org.springframework.stereotype.Component;

/**
 * Detects value moved under cover of trade payments: large wires with erratic
 * amounts (over/under invoicing). Activation floor 0.5.
 */
@Component
public class TradeBasedLaunderingDetector implements TypologyDetector {

    private static final double ACTIVATION_FLOOR = 0.5;

    @Override
    public Typology getTypology() {
        return Typology.TBML;
    }

    @Override
    public TypologyMatch detect(AdjudicationInput input) {
        AccountStats stats = input.getStats();

        return new SignalTally(getTypology())
                .check(input.getTransaction().getAmountSent() > 100000, "high_value_transaction", 0.2)
                .check(stats.getStdTransactionAmount() > stats.getAvgTransactionAmount(),
                        "high_amount_variance", 0.25)
                .check("Wire".equals(input.getTransaction().getPaymentFormat()), "wire_transfer", 0.1)
                .check(input.getStatisticalScore() > 7.0, "extreme_statistical_anomaly", 0.25)
                .check(input.getNarrativeScore() < 0.4, "narrative_break", 0.2)
                .matchIfAtLeast(ACTIVATION_FLOOR);
    }
}
