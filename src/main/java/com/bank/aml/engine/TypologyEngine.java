package com.bank.aml.engine;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered typology detector against an adjudication input.
 * Uses the Strategy pattern: each Typology is handled by one TypologyDetector.
 */
@Component
public class TypologyEngine {

    private static final Logger log = LoggerFactory.getLogger(TypologyEngine.class);

    private final List<TypologyDetector> detectors;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public TypologyEngine(List<TypologyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        // Declaration order of Typology breaks confidence ties
        List<TypologyDetector> ordered = new ArrayList<>(detectors);
        ordered.sort(Comparator.comparing(TypologyDetector::getTypology));
        this.detectors = List.copyOf(ordered);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (TypologyDetector detector : this.detectors) {
            log.info("Registered typology detector: {} -> {}",
                    detector.getTypology(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all detectors and rank the matches.
     *
     * @return matches sorted by confidence descending; the first element is the primary typology
     */
    @Observed(name = "typology.detect_all", contextualName = "detect-all-typologies")
    public List<TypologyMatch> detectAll(AdjudicationInput input) {
        String txnId = input.getTransaction().getTxnId();
        List<TypologyMatch> matches = new ArrayList<>();

        for (TypologyDetector detector : detectors) {
            Typology typology = detector.getTypology();
            Span span = tracer.nextSpan()
                    .name("typology.detect." + typology)
                    .tag("typology", typology.getDisplayName())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                TypologyMatch match = detector.detect(input);
                span.tag("typology.matched", String.valueOf(match != null));
                if (match != null) {
                    span.tag("typology.confidence", String.valueOf(match.getConfidence()));
                    matches.add(match);
                    metricsConfig.recordTypologyDetected(match.getName());
                    log.debug("Typology {} matched for txn {}: confidence={}, signals={}",
                            match.getName(), txnId, match.getConfidence(), match.getSignalsMatched());
                }
            } catch (Exception e) {
                span.error(e);
                log.error("Error running {} detector for txn {}: {}",
                        typology, txnId, e.getMessage(), e);
                // One faulty detector must not hide the others
            } finally {
                span.end();
            }
        }

        // List.sort is stable
        matches.sort(Comparator.comparingDouble(TypologyMatch::getConfidence).reversed());
        return matches;
    }

    public List<TypologyDetector> getDetectors() {
        return detectors;
    }
}
