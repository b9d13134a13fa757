package com.bank.aml.engine;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.engine.detectors.*;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;
import com.bank.aml.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TypologyEngineTest {

    private SimpleMeterRegistry registry;
    private TypologyEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = new TypologyEngine(allDetectors(), Tracer.NOOP, new MetricsConfig(registry));
    }

    private static List<TypologyDetector> allDetectors() {
        // Deliberately shuffled; the engine orders them by typology
        return List.of(
                new TradeBasedLaunderingDetector(),
                new LayeringDetector(),
                new StructuringDetector(),
                new ShellCompanyDetector(),
                new SmurfingDetector());
    }

    @Test
    void constructor_ordersDetectorsByTypologyDeclaration() {
        assertThat(engine.getDetectors())
                .extracting(TypologyDetector::getTypology)
                .containsExactly(Typology.STRUCTURING, Typology.SMURFING, Typology.LAYERING,
                        Typology.SHELL_COMPANY, Typology.TBML);
    }

    @Test
    void detectAll_structuringScenario_ranksStructuringFirst() {
        AdjudicationInput input = TestDataFactory.createInput(9800, 7.5, 0.25,
                TestDataFactory.defaultStats().transactionFrequencyPerDay(4.0).build());

        List<TypologyMatch> matches = engine.detectAll(input);

        assertThat(matches).extracting(TypologyMatch::getName)
                .containsExactly("Structuring", "Trade-Based Money Laundering", "Smurfing");
        assertThat(matches.get(0).getConfidence()).isEqualTo(1.0);
        assertThat(matches.get(1).getConfidence()).isCloseTo(0.55, within(1e-9));
        assertThat(matches.get(2).getConfidence()).isCloseTo(0.4, within(1e-9));
        assertThat(registry.get("typology.detected.count").tag("typology", "Structuring").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void detectAll_smurfingScenario_ranksSmurfingAboveStructuring() {
        AdjudicationInput input = TestDataFactory.createInput(1500, 6.0, 0.35,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(8.0)
                        .uniqueCounterparties(40)
                        .build());

        List<TypologyMatch> matches = engine.detectAll(input);

        assertThat(matches).isNotEmpty();
        assertThat(matches.get(0).getName()).isEqualTo("Smurfing");
        assertThat(matches.get(0).getConfidence()).isEqualTo(1.0);
        assertThat(matches).extracting(TypologyMatch::getName).contains("Structuring");
    }

    @Test
    void detectAll_layeringScenario_detectsLayering() {
        AdjudicationInput input = TestDataFactory.createInput(25000, 8.0, 0.15,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(10.0)
                        .totalSent(500000.0)
                        .totalReceived(500000.0)
                        .avgTransactionAmount(5000.0)
                        .stdTransactionAmount(2500.0)
                        .build());

        List<TypologyMatch> matches = engine.detectAll(input);

        assertThat(matches).extracting(TypologyMatch::getName).contains("Layering");
        TypologyMatch layering = matches.stream()
                .filter(m -> m.getName().equals("Layering"))
                .findFirst().orElseThrow();
        assertThat(layering.getConfidence()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void detectAll_cleanTransaction_returnsEmptyList() {
        AdjudicationInput input = TestDataFactory.createInput(750, 1.5, 0.85,
                TestDataFactory.defaultStats()
                        .transactionFrequencyPerDay(0.5)
                        .uniqueCounterparties(8)
                        .build());

        assertThat(engine.detectAll(input)).isEmpty();
    }

    @Test
    void detectAll_equalConfidence_keepsTypologyDeclarationOrder() {
        TypologyDetector shell = stubDetector(Typology.SHELL_COMPANY, 0.6);
        TypologyDetector smurfing = stubDetector(Typology.SMURFING, 0.6);
        TypologyEngine tieEngine = new TypologyEngine(List.of(shell, smurfing), Tracer.NOOP,
                new MetricsConfig(new SimpleMeterRegistry()));

        List<TypologyMatch> matches = tieEngine.detectAll(TestDataFactory.createDefaultInput());

        assertThat(matches).extracting(TypologyMatch::getName)
                .containsExactly("Smurfing", "Shell Company Activity");
    }

    @Test
    void detectAll_failingDetector_isSkipped() {
        TypologyDetector broken = mock(TypologyDetector.class);
        when(broken.getTypology()).thenReturn(Typology.STRUCTURING);
        when(broken.detect(any())).thenThrow(new IllegalStateException("boom"));
        TypologyDetector layering = stubDetector(Typology.LAYERING, 0.7);
        TypologyEngine partialEngine = new TypologyEngine(List.of(broken, layering), Tracer.NOOP,
                new MetricsConfig(new SimpleMeterRegistry()));

        List<TypologyMatch> matches = partialEngine.detectAll(TestDataFactory.createDefaultInput());

        assertThat(matches).extracting(TypologyMatch::getName).containsExactly("Layering");
    }

    private static TypologyDetector stubDetector(Typology typology, double confidence) {
        TypologyDetector detector = mock(TypologyDetector.class);
        when(detector.getTypology()).thenReturn(typology);
        when(detector.detect(any())).thenReturn(
                TestDataFactory.createMatch(typology, confidence, "stub_signal"));
        return detector;
    }
}
