package com.bank.aml.engine.detectors;

import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.TypologyMatch;
import com.bank.aml.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LayeringDetectorTest {

    private final LayeringDetector detector = new LayeringDetector();

    @Test
    void detect_rapidBalancedFlow_matches() {
        AdjudicationInput input = TestDataFactory.createInput(25000, 8.0, 0.15,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(10.0)
                        .totalSent(500000.0)
                        .totalReceived(500000.0)
                        .avgTransactionAmount(5000.0)
                        .stdTransactionAmount(2500.0)
                        .build());

        TypologyMatch match = detector.detect(input);

        assertThat(match).isNotNull();
        assertThat(match.getName()).isEqualTo("Layering");
        assertThat(match.getConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(match.getSignalsMatched()).containsExactly(
                "very_high_frequency", "in_equals_out", "high_statistical_anomaly", "very_low_coherence");
    }

    @Test
    void detect_frequencyAndVolumeReachFloor_matches() {
        AdjudicationInput input = TestDataFactory.createInput(500, 1.0, 0.9,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(6.0)
                        .totalTransactions(101)
                        .build());

        TypologyMatch match = detector.detect(input);

        assertThat(match).isNotNull();
        assertThat(match.getConfidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void detect_frequencyAlone_returnsNull() {
        AdjudicationInput input = TestDataFactory.createInput(500, 1.0, 0.9,
                TestDataFactory.defaultStats().transactionFrequencyPerDay(6.0).build());

        assertThat(detector.detect(input)).isNull();
    }
}
