package com.bank.aml.service;

import com.bank.aml.config.TribunalConfig;
import com.bank.aml.model.AccountStats;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.DateRange;
import com.bank.aml.model.RecommendedAction;
import com.bank.aml.model.RegulatoryReference;
import com.bank.aml.model.RiskFactor;
import com.bank.aml.model.SarDraft;
import com.bank.aml.model.Severity;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TypologyMatch;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Assembles a draft Suspicious Activity Report for BLOCK and REVIEW verdicts.
 * Output is a pure function of its arguments; the subject is identified by
 * account id only.
 */
@Service
public class ReportDraftingService {

    static final String UNUSUAL_ACTIVITY = "Unusual Activity";

    private static final DateTimeFormatter DATE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final TribunalConfig config;

    public ReportDraftingService(TribunalConfig config) {
        this.config = config;
    }

    public SarDraft draft(AdjudicationInput input, TypologyMatch primary,
                          List<RiskFactor> riskFactors, String reasoning) {
        Transaction txn = input.getTransaction();
        AccountStats stats = input.getStats();

        String activityType = primary != null ? primary.getName() : UNUSUAL_ACTIVITY;

        List<String> redFlags = new ArrayList<>();
        for (RiskFactor factor : riskFactors) {
            redFlags.add(factor.getFactor() + ": " + factor.getDescription());
        }
        if (primary != null) {
            for (String signal : primary.getSignalsMatched()) {
                redFlags.add("Signal: " + signal);
            }
        }

        return SarDraft.builder()
                .subjectAccount(input.getAccountHistory().getAccountId())
                .subjectName(null)
                .filingInstitution(config.getReport().getFilingInstitution())
                .activityType(activityType)
                .activityDateRange(DateRange.builder()
                        .start(stats.getFirstTransaction())
                        .end(txn.getTimestamp())
                        .build())
                .totalAmountInvolved(stats.getTotalSent() + txn.getAmountSent())
                .summary(summary(input, primary, riskFactors))
                .detailedDescription(detailedDescription(input, primary, riskFactors, reasoning))
                .transactionIds(txn.getTxnId() != null && !txn.getTxnId().isEmpty()
                        ? List.of(txn.getTxnId()) : List.of())
                .redFlags(List.copyOf(redFlags))
                .regulatoryReferences(referencesFor(activityType))
                .recommendedAction(recommendAction(primary, riskFactors))
                .build();
    }

    /**
     * First matching rule wins: strong typology, any critical factor, three or more factors.
     */
    RecommendedAction recommendAction(TypologyMatch primary, List<RiskFactor> riskFactors) {
        if (primary != null && primary.getConfidence() > 0.7) {
            return RecommendedAction.FILE_SAR;
        }
        if (riskFactors.stream().anyMatch(f -> f.getSeverity() == Severity.CRITICAL)) {
            return RecommendedAction.FILE_SAR;
        }
        if (riskFactors.size() >= 3) {
            return RecommendedAction.ESCALATE_TO_COMPLIANCE;
        }
        return RecommendedAction.ENHANCED_MONITORING;
    }

    List<RegulatoryReference> referencesFor(String activityType) {
        List<RegulatoryReference> refs = new ArrayList<>();
        refs.add(RegulatoryReference.of("FATF", "Recommendation 20", "Reporting of suspicious transactions"));

        if ("Structuring".equals(activityType)) {
            refs.add(RegulatoryReference.of("FinCEN", "31 CFR 1010.314",
                    "Structuring transactions to evade reporting requirements"));
            refs.add(RegulatoryReference.of("FATF", "Recommendation 10",
                    "Customer due diligence for suspicious patterns"));
        } else if ("Smurfing".equals(activityType)) {
            refs.add(RegulatoryReference.of("FATF", "Recommendation 10",
                    "Customer due diligence and ongoing monitoring"));
            refs.add(RegulatoryReference.of("EU AMLD6", "Article 3(4)(f)",
                    "Money laundering through multiple transactions"));
        } else if ("Layering".equals(activityType)) {
            refs.add(RegulatoryReference.of("FATF", "Recommendation 16",
                    "Wire transfers and beneficiary information"));
            refs.add(RegulatoryReference.of("EU AMLR", "Article 50",
                    "Enhanced monitoring for complex transactions"));
        } else if (activityType.contains("Trade")) {
            refs.add(RegulatoryReference.of("FATF", "Trade-Based Money Laundering Typologies Report",
                    "Red flags and detection methods for TBML"));
            refs.add(RegulatoryReference.of("Wolfsberg", "Trade Finance Principles",
                    "Due diligence for trade transactions"));
        } else if (activityType.contains("Shell")) {
            refs.add(RegulatoryReference.of("FATF", "Recommendation 24",
                    "Transparency of beneficial ownership"));
            refs.add(RegulatoryReference.of("EU AMLD5", "Article 30",
                    "Beneficial ownership registers"));
        }
        return List.copyOf(refs);
    }

    private String summary(AdjudicationInput input, TypologyMatch primary, List<RiskFactor> riskFactors) {
        Transaction txn = input.getTransaction();
        AccountStats stats = input.getStats();

        String summary = String.format(Locale.US,
                "Account %s has been flagged for potential %s. " +
                "A transaction of $%,.2f via %s on %s triggered automated detection systems. " +
                "The account has processed %d transactions totaling $%,.2f sent and $%,.2f received. " +
                "Statistical analysis indicates a %.1f/10 anomaly score, " +
                "and narrative coherence analysis shows %.0f%% consistency with historical behavior.",
                input.getAccountHistory().getAccountId(),
                primary != null ? primary.getName() : "suspicious activity",
                txn.getAmountSent(), txn.getPaymentFormat(), DATE.format(Instant.ofEpochMilli(txn.getTimestamp())),
                stats.getTotalTransactions(), stats.getTotalSent(), stats.getTotalReceived(),
                input.getStatisticalScore(), input.getNarrativeScore() * 100);

        if (!riskFactors.isEmpty()) {
            summary += " " + riskFactors.size() + " risk factors were identified.";
        }
        return summary;
    }

    private String detailedDescription(AdjudicationInput input, TypologyMatch primary,
                                       List<RiskFactor> riskFactors, String reasoning) {
        Transaction txn = input.getTransaction();
        AccountStats stats = input.getStats();
        List<String> sections = new ArrayList<>();

        sections.add(String.format(Locale.US,
                "TRANSACTION DETAILS:\n" +
                "- Transaction ID: %s\n" +
                "- Date/Time: %s\n" +
                "- Amount Sent: $%,.2f %s\n" +
                "- Amount Received: $%,.2f %s\n" +
                "- Payment Method: %s\n" +
                "- Sender: Account %s at Bank %s\n" +
                "- Receiver: Account %s at Bank %s",
                txn.getTxnId() != null ? txn.getTxnId() : "N/A",
                DATE_TIME.format(Instant.ofEpochMilli(txn.getTimestamp())),
                txn.getAmount().getSent(), txn.getAmount().getCurrencySent(),
                txn.getAmount().getReceived(), txn.getAmount().getCurrencyReceived(),
                txn.getPaymentFormat(),
                txn.getSender().getAccountId(), txn.getSender().getBankId(),
                txn.getReceiver().getAccountId(), txn.getReceiver().getBankId()));

        sections.add(String.format(Locale.US,
                "ACCOUNT HISTORY:\n" +
                "- Total Transactions: %d\n" +
                "- Total Sent: $%,.2f\n" +
                "- Total Received: $%,.2f\n" +
                "- Average Transaction: $%,.2f\n" +
                "- Unique Counterparties: %d\n" +
                "- Transaction Frequency: %.2f/day\n" +
                "- Account Active Since: %s",
                stats.getTotalTransactions(), stats.getTotalSent(), stats.getTotalReceived(),
                stats.getAvgTransactionAmount(), stats.getUniqueCounterparties(),
                stats.getTransactionFrequencyPerDay(),
                DATE.format(Instant.ofEpochMilli(stats.getFirstTransaction()))));

        String trigger = input.getTriggeredBy().getLabel();
        sections.add(String.format(Locale.US,
                "DETECTION ANALYSIS:\n" +
                "- Statistical Anomaly Score: %.2f/10.0\n" +
                "- Narrative Coherence Score: %.2f%%\n" +
                "- Triggered By: %s Engine",
                input.getStatisticalScore(), input.getNarrativeScore() * 100,
                Character.toUpperCase(trigger.charAt(0)) + trigger.substring(1)));

        if (primary != null) {
            sections.add(String.format(Locale.US,
                    "TYPOLOGY ANALYSIS:\n" +
                    "- Detected Pattern: %s\n" +
                    "- Confidence: %.0f%%\n" +
                    "- Description: %s\n" +
                    "- Signals Matched:\n",
                    primary.getName(), primary.getConfidence() * 100, primary.getDescription())
                    + primary.getSignalsMatched().stream()
                            .map(s -> "  * " + s)
                            .collect(Collectors.joining("\n")));
        }

        if (!riskFactors.isEmpty()) {
            StringBuilder risk = new StringBuilder("RISK FACTORS:\n");
            int i = 1;
            for (RiskFactor factor : riskFactors) {
                risk.append(i++).append(". ").append(factor.getFactor())
                        .append(" [").append(factor.getSeverity().name()).append("]\n")
                        .append("   ").append(factor.getDescription()).append('\n');
                if (!factor.getEvidence().isEmpty()) {
                    risk.append("   Evidence: ").append(String.join(", ", factor.getEvidence())).append('\n');
                }
            }
            sections.add(risk.toString());
        }

        sections.add("AI ANALYSIS:\n" + (reasoning != null ? reasoning : ""));

        return String.join("\n\n", sections);
    }
}
