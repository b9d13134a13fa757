package com.bank.aml.engine.detectors;

import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.TypologyMatch;
import com.bank.aml.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SmurfingDetectorTest {

    private final SmurfingDetector detector = new SmurfingDetector();

    @Test
    void detect_smallFrequentManyCounterparties_matches() {
        AdjudicationInput input = TestDataFactory.createInput(1500, 6.0, 0.35,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(8.0)
                        .uniqueCounterparties(40)
                        .build());

        TypologyMatch match = detector.detect(input);

        assertThat(match).isNotNull();
        assertThat(match.getName()).isEqualTo("Smurfing");
        assertThat(match.getConfidence()).isGreaterThanOrEqualTo(0.5);
        assertThat(match.getSignalsMatched()).containsExactly(
                "small_amount_high_frequency",
                "many_counterparties",
                "statistical_anomaly",
                "narrative_break",
                "balanced_in_out");
    }

    @Test
    void detect_noReceivedVolume_skipsBalanceSignal() {
        AdjudicationInput input = TestDataFactory.createInput(1000, 1.0, 0.9,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(3.0)
                        .totalReceived(0.0)
                        .build());

        // 0.35 alone stays under the 0.4 floor
        assertThat(detector.detect(input)).isNull();
    }

    @Test
    void detect_balancedVolume_liftsOverFloor() {
        AdjudicationInput input = TestDataFactory.createInput(1000, 1.0, 0.9,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(3.0)
                        .totalReceived(50000.0)
                        .build());

        TypologyMatch match = detector.detect(input);

        assertThat(match).isNotNull();
        assertThat(match.getSignalsMatched()).containsExactly("small_amount_high_frequency", "balanced_in_out");
        assertThat(match.getConfidence()).isCloseTo(0.45, within(1e-9));
    }

    @Test
    void detect_largeAmount_doesNotCountAsSmall() {
        AdjudicationInput input = TestDataFactory.createInput(5000, 1.0, 0.9,
                TestDataFactory.defaultStats().transactionFrequencyPerDay(3.0).build());

        assertThat(detector.detect(input)).isNull();
    }
}
