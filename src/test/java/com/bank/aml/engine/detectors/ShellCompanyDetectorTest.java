package com.bank.aml.engine.detectors;

import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.TypologyMatch;
import com.bank.aml.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ShellCompanyDetectorTest {

    private final ShellCompanyDetector detector = new ShellCompanyDetector();

    @Test
    void detect_passthroughAlone_staysBelowFloor() {
        AdjudicationInput input = TestDataFactory.createInput(500, 1.0, 0.9,
                TestDataFactory.defaultStats().totalReceived(50000.0).build());

        assertThat(detector.detect(input)).isNull();
    }

    @Test
    void detect_passthroughWithAnomaly_matches() {
        AdjudicationInput input = TestDataFactory.createInput(500, 5.5, 0.9,
                TestDataFactory.defaultStats().totalReceived(50000.0).build());

        TypologyMatch match = detector.detect(input);

        assertThat(match).isNotNull();
        assertThat(match.getName()).isEqualTo("Shell Company Activity");
        assertThat(match.getSignalsMatched()).containsExactly("exact_passthrough", "statistical_anomaly");
    }

    @Test
    void detect_fewCounterpartiesInfrequentHighValue_matches() {
        AdjudicationInput input = TestDataFactory.createInput(60000, 1.0, 0.9,
                TestDataFactory.defaultStats()
                        .totalTransactions(25)
                        .totalSent(1500000.0)
                        .totalReceived(1000000.0)
                        .avgTransactionAmount(60000.0)
                        .uniqueCounterparties(3)
                        .transactionFrequencyPerDay(0.5)
                        .build());

        TypologyMatch match = detector.detect(input);

        assertThat(match).isNotNull();
        assertThat(match.getSignalsMatched()).containsExactly("limited_counterparties", "high_value_low_frequency");
    }

    @Test
    void detect_noVolume_skipsPassthrough() {
        AdjudicationInput input = TestDataFactory.createInput(500, 5.5, 0.9,
                TestDataFactory.defaultStats().totalSent(0.0).totalReceived(0.0).avgTransactionAmount(0.0).build());

        assertThat(detector.detect(input)).isNull();
    }
}
