package com.bank.aml.config;

import com.bank.aml.model.EvaluationMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    private final AtomicLong truePositives = new AtomicLong();
    private final AtomicLong falsePositives = new AtomicLong();
    private final AtomicLong trueNegatives = new AtomicLong();
    private final AtomicLong falseNegatives = new AtomicLong();

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPipelineDecision(String decision, String exitLayer, double confidence) {
        Counter.builder("pipeline.decision.count")
                .tag("decision", decision)
                .tag("exit_layer", exitLayer)
                .register(registry)
                .increment();

        DistributionSummary.builder("pipeline.decision.confidence")
                .tag("decision", decision)
                .register(registry)
                .record(confidence);
    }

    public void recordTypologyDetected(String typology) {
        Counter.builder("typology.detected.count")
                .tag("typology", typology)
                .register(registry)
                .increment();
    }

    public void recordDowngrade(String from, String to) {
        Counter.builder("verdict.downgrade.count")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordMalformedReasoning() {
        Counter.builder("reasoning.malformed.count")
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Record a decision against its ground-truth label. Flagged means the
     * pipeline did not approve the transaction.
     */
    public void recordLabelledOutcome(boolean flagged, boolean laundering) {
        String outcome;
        if (flagged && laundering) {
            truePositives.incrementAndGet();
            outcome = "tp";
        } else if (flagged) {
            falsePositives.incrementAndGet();
            outcome = "fp";
        } else if (laundering) {
            falseNegatives.incrementAndGet();
            outcome = "fn";
        } else {
            trueNegatives.incrementAndGet();
            outcome = "tn";
        }
        Counter.builder("detection.outcome.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public EvaluationMetrics detectionMetrics() {
        return EvaluationMetrics.builder()
                .truePositives(truePositives.get())
                .falsePositives(falsePositives.get())
                .trueNegatives(trueNegatives.get())
                .falseNegatives(falseNegatives.get())
                .build();
    }
}
