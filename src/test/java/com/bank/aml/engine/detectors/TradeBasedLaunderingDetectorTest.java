package com.bank.aml.engine.detectors;

import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TypologyMatch;
import com.bank.aml.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TradeBasedLaunderingDetectorTest {

    private final TradeBasedLaunderingDetector detector = new TradeBasedLaunderingDetector();

    @Test
    void detect_largeErraticWire_matches() {
        AdjudicationInput input = TestDataFactory.createInput(150000, 1.0, 0.9,
                TestDataFactory.defaultStats().stdTransactionAmount(800.0).build());

        TypologyMatch match = detector.detect(input);

        assertThat(match).isNotNull();
        assertThat(match.getName()).isEqualTo("Trade-Based Money Laundering");
        assertThat(match.getSignalsMatched())
                .containsExactly("high_value_transaction", "high_amount_variance", "wire_transfer");
    }

    @Test
    void detect_samePatternOverAch_returnsNull() {
        AdjudicationInput wire = TestDataFactory.createInput(150000, 1.0, 0.9,
                TestDataFactory.defaultStats().stdTransactionAmount(800.0).build());
        Transaction ach = wire.getTransaction().toBuilder().paymentFormat("ACH").build();
        AdjudicationInput input = AdjudicationInput.builder()
                .transaction(ach)
                .statisticalScore(wire.getStatisticalScore())
                .narrativeScore(wire.getNarrativeScore())
                .accountHistory(wire.getAccountHistory())
                .triggeredBy(wire.getTriggeredBy())
                .build();

        assertThat(detector.detect(input)).isNull();
    }

    @Test
    void detect_extremeAnomalyWithNarrativeBreak_matches() {
        TypologyMatch match = detector.detect(TestDataFactory.createInput(9800, 7.5, 0.25));

        assertThat(match).isNotNull();
        assertThat(match.getSignalsMatched())
                .containsExactly("wire_transfer", "extreme_statistical_anomaly", "narrative_break");
    }
}
