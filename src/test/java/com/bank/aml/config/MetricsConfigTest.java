package com.bank.aml.config;

import com.bank.aml.model.EvaluationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsConfigTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsConfig metricsConfig = new MetricsConfig(registry);

    @Test
    void recordLabelledOutcome_fillsConfusionMatrix() {
        metricsConfig.recordLabelledOutcome(true, true);
        metricsConfig.recordLabelledOutcome(true, true);
        metricsConfig.recordLabelledOutcome(true, false);
        metricsConfig.recordLabelledOutcome(false, true);
        metricsConfig.recordLabelledOutcome(false, false);

        EvaluationMetrics metrics = metricsConfig.detectionMetrics();

        assertThat(metrics.getTruePositives()).isEqualTo(2);
        assertThat(metrics.getFalsePositives()).isEqualTo(1);
        assertThat(metrics.getFalseNegatives()).isEqualTo(1);
        assertThat(metrics.getTrueNegatives()).isEqualTo(1);
        assertThat(registry.get("detection.outcome.count").tag("outcome", "tp").counter().count()).isEqualTo(2.0);
    }

    @Test
    void recordPipelineDecision_tagsDecisionAndExitLayer() {
        metricsConfig.recordPipelineDecision("APPROVE", "statistical", 0.9);
        metricsConfig.recordPipelineDecision("APPROVE", "statistical", 0.7);

        assertThat(registry.get("pipeline.decision.count")
                .tag("decision", "APPROVE").tag("exit_layer", "statistical").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("pipeline.decision.confidence").tag("decision", "APPROVE").summary().mean())
                .isCloseTo(0.8, within(1e-9));
    }
}
