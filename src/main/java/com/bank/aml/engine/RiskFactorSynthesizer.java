package com.bank.aml.engine;

import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.RiskFactor;
import com.bank.aml.model.Severity;
import com.bank.aml.model.TypologyMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns gate scores, the primary typology and the transaction amount into
 * severity-tagged risk factors. Stateless; the same input always yields the
 * same factors in the same order.
 */
@Component
public class RiskFactorSynthesizer {

    static final double EXTREME_STATISTICAL = 7.0;
    static final double HIGH_STATISTICAL = 5.0;
    static final double SEVERE_NARRATIVE = 0.3;
    static final double WEAK_NARRATIVE = 0.5;
    static final double CRITICAL_TYPOLOGY_CONFIDENCE = 0.7;

    /**
     * @param primary the highest-ranked typology match, or {@code null} when none was detected
     */
    public List<RiskFactor> synthesize(AdjudicationInput input, TypologyMatch primary) {
        List<RiskFactor> factors = new ArrayList<>();

        double stat = input.getStatisticalScore();
        String zEvidence = String.format(Locale.US, "Z-score: %.2f", stat);
        if (stat > EXTREME_STATISTICAL) {
            factors.add(RiskFactor.builder()
                    .factor("Extreme Statistical Anomaly")
                    .severity(Severity.CRITICAL)
                    .description(String.format(Locale.US,
                            "Transaction has statistical anomaly score of %.1f (threshold: 3.0)", stat))
                    .evidence(List.of(zEvidence))
                    .build());
        } else if (stat > HIGH_STATISTICAL) {
            factors.add(RiskFactor.builder()
                    .factor("High Statistical Anomaly")
                    .severity(Severity.HIGH)
                    .description("Transaction deviates significantly from peer group baseline")
                    .evidence(List.of(zEvidence))
                    .build());
        }

        double narrative = input.getNarrativeScore();
        String coherenceEvidence = String.format(Locale.US, "Coherence score: %.2f", narrative);
        if (narrative < SEVERE_NARRATIVE) {
            factors.add(RiskFactor.builder()
                    .factor("Severe Narrative Break")
                    .severity(Severity.CRITICAL)
                    .description("Transaction is highly inconsistent with customer's behavioral history")
                    .evidence(List.of(coherenceEvidence))
                    .build());
        } else if (narrative < WEAK_NARRATIVE) {
            factors.add(RiskFactor.builder()
                    .factor("Narrative Inconsistency")
                    .severity(Severity.HIGH)
                    .description("Transaction does not fit customer's typical pattern")
                    .evidence(List.of(coherenceEvidence))
                    .build());
        }

        if (primary != null) {
            factors.add(RiskFactor.builder()
                    .factor(primary.getName() + " Pattern Detected")
                    .severity(primary.getConfidence() > CRITICAL_TYPOLOGY_CONFIDENCE
                            ? Severity.CRITICAL : Severity.HIGH)
                    .description(primary.getDescription())
                    .evidence(primary.getSignalsMatched())
                    .build());
        }

        double amount = input.getTransaction().getAmountSent();
        if (amount >= 9000 && amount < 10000) {
            factors.add(RiskFactor.builder()
                    .factor("Near-Threshold Amount")
                    .severity(Severity.MEDIUM)
                    .description("Transaction amount is just below $10,000 reporting threshold")
                    .evidence(List.of(String.format(Locale.US, "Amount: $%,.2f", amount)))
                    .build());
        }

        return factors;
    }
}
