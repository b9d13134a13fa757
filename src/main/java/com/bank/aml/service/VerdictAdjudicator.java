package com.bank.aml.service;

import com.bank.aml.client.ReasoningClient;
import com.bank.aml.config.MetricsConfig;
import com.bank.aml.config.ReasoningClientConfig;
import com.bank.aml.config.TribunalConfig;
import com.bank.aml.engine.RiskFactorSynthesizer;
import com.bank.aml.engine.TypologyEngine;
import com.bank.aml.model.AccountStats;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Decision;
import com.bank.aml.model.ReasoningOutcome;
import com.bank.aml.model.RegulatoryReference;
import com.bank.aml.model.RiskFactor;
import com.bank.aml.model.SarDraft;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TypologyMatch;
import com.bank.aml.model.Verdict;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Final stage of the tribunal. Combines typology detection, risk factors,
 * regulatory context and a language-model decision into a {@link Verdict}.
 *
 * Flow:
 * 1. Detect typologies; the top match is the primary typology
 * 2. Synthesize risk factors
 * 3. Retrieve regulatory context
 * 4. Ask the reasoning service for a JSON decision and decode it strictly
 * 5. Demote low-confidence BLOCK and APPROVE decisions to REVIEW
 * 6. Draft a SAR for BLOCK and REVIEW
 */
@Service
public class VerdictAdjudicator {

    private static final Logger log = LoggerFactory.getLogger(VerdictAdjudicator.class);

    static final String CITATION_RELEVANCE = "Cited in adjudication reasoning";

    static final String SYSTEM_PROMPT =
            "You are a senior AML/CFT compliance expert acting as the final decision maker " +
            "in a staged transaction screening tribunal.\n\n" +
            "Your background:\n" +
            "- Former MLRO (Money Laundering Reporting Officer) at a Tier 1 bank\n" +
            "- Certified Anti-Money Laundering Specialist (CAMS)\n" +
            "- Deep expertise in FATF recommendations, EU AML directives, and US regulations\n\n" +
            "Your role:\n" +
            "- You are invoked ONLY when the statistical and narrative gates flag suspicious activity\n" +
            "- You receive pre-computed scores: statistical_score (0-10) and narrative_score (0-1)\n" +
            "- You must synthesize these signals with regulatory knowledge to make a final decision\n\n" +
            "Your task:\n" +
            "1. Analyze the transaction and account history\n" +
            "2. Consider the statistical and narrative scores\n" +
            "3. Identify the most likely money laundering typology (if any)\n" +
            "4. Make a decision: BLOCK, APPROVE, or REVIEW\n" +
            "5. Provide clear reasoning citing specific regulations\n\n" +
            "Output format - respond with JSON only:\n" +
            "{\n" +
            "    \"decision\": \"BLOCK\" | \"APPROVE\" | \"REVIEW\",\n" +
            "    \"confidence\": 0.0-1.0,\n" +
            "    \"typology\": \"Structuring\" | \"Smurfing\" | \"Layering\" | \"TBML\" | \"Shell Company\" | null,\n" +
            "    \"reasoning\": \"Your detailed reasoning here\",\n" +
            "    \"key_risk_factors\": [\"factor1\", \"factor2\"],\n" +
            "    \"regulatory_citations\": [\"FATF Rec 20\", \"EU AMLD6 Art 3\"]\n" +
            "}\n";

    private static final DateTimeFormatter PROMPT_DATE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final TypologyEngine typologyEngine;
    private final RiskFactorSynthesizer riskFactorSynthesizer;
    private final RegulatoryContextService regulatoryContextService;
    private final ReasoningClient reasoningClient;
    private final ReasoningResponseParser responseParser;
    private final ReportDraftingService reportDraftingService;
    private final TribunalConfig tribunalConfig;
    private final ReasoningClientConfig reasoningConfig;
    private final MetricsConfig metricsConfig;

    public VerdictAdjudicator(TypologyEngine typologyEngine,
                              RiskFactorSynthesizer riskFactorSynthesizer,
                              RegulatoryContextService regulatoryContextService,
                              ReasoningClient reasoningClient,
                              ReasoningResponseParser responseParser,
                              ReportDraftingService reportDraftingService,
                              TribunalConfig tribunalConfig,
                              ReasoningClientConfig reasoningConfig,
                              MetricsConfig metricsConfig) {
        this.typologyEngine = typologyEngine;
        this.riskFactorSynthesizer = riskFactorSynthesizer;
        this.regulatoryContextService = regulatoryContextService;
        this.reasoningClient = reasoningClient;
        this.responseParser = responseParser;
        this.reportDraftingService = reportDraftingService;
        this.tribunalConfig = tribunalConfig;
        this.reasoningConfig = reasoningConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "tribunal.adjudicate", contextualName = "adjudicate-transaction")
    public Verdict adjudicate(AdjudicationInput input) {
        long startNanos = System.nanoTime();
        String txnId = input.getTransaction().getTxnId();

        List<TypologyMatch> matches = typologyEngine.detectAll(input);
        TypologyMatch primary = matches.isEmpty() ? null : matches.get(0);

        List<RiskFactor> riskFactors = riskFactorSynthesizer.synthesize(input, primary);

        String regulatoryContext = regulatoryContextService.buildContext(input, primary);

        String model = reasoningConfig.getModel();
        String raw = reasoningClient.chat(buildPrompt(input, primary, regulatoryContext), SYSTEM_PROMPT,
                model, reasoningConfig.getMaxTokens(), reasoningConfig.getTemperature());

        ReasoningOutcome outcome = responseParser.parse(raw);
        if (outcome.isMalformed()) {
            metricsConfig.recordMalformedReasoning();
            log.warn("Malformed reasoning response for txn {}; falling back to REVIEW", txnId);
        }

        Decision decision = applyConfidenceFloors(outcome.getDecision(), outcome.getConfidence(), txnId);

        SarDraft sarDraft = null;
        if (decision.requiresReport()) {
            sarDraft = reportDraftingService.draft(input, primary, riskFactors, outcome.getReasoning());
        }

        double processingTimeMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        log.info("Adjudicated txn {}: decision={}, confidence={}, typology={}, time={}ms",
                txnId, decision, outcome.getConfidence(),
                primary != null ? primary.getName() : "none", String.format(Locale.US, "%.1f", processingTimeMs));

        return Verdict.builder()
                .decision(decision)
                .confidence(outcome.getConfidence())
                .typology(primary != null ? primary.getName() : null)
                .typologyConfidence(primary != null ? primary.getConfidence() : null)
                .riskFactors(riskFactors)
                .riskScore(input.getStatisticalScore())
                .citations(citations(outcome.getRegulatoryCitations()))
                .sarDraft(sarDraft)
                .reasoning(outcome.getReasoning())
                .processingTimeMs(processingTimeMs)
                .modelUsed(model)
                .build();
    }

    /**
     * BLOCK below the block floor and APPROVE below the review floor become REVIEW.
     */
    Decision applyConfidenceFloors(Decision decision, double confidence, String txnId) {
        TribunalConfig.Thresholds thresholds = tribunalConfig.getThresholds();
        Decision result = decision;
        if (decision == Decision.BLOCK && confidence < thresholds.getExpertConfidenceBlock()) {
            result = Decision.REVIEW;
        } else if (decision == Decision.APPROVE && confidence < thresholds.getExpertConfidenceReview()) {
            result = Decision.REVIEW;
        }
        if (result != decision) {
            metricsConfig.recordDowngrade(decision.name(), result.name());
            log.warn("Txn {}: {} at confidence {} demoted to {}", txnId, decision, confidence, result);
        }
        return result;
    }

    List<RegulatoryReference> citations(List<String> cited) {
        List<RegulatoryReference> refs = new ArrayList<>();
        for (String ref : cited) {
            String trimmed = ref != null ? ref.trim() : "";
            String source = trimmed.isEmpty() ? "Unknown" : trimmed.split("\\s+")[0];
            refs.add(RegulatoryReference.of(source, ref, CITATION_RELEVANCE));
        }
        return List.copyOf(refs);
    }

    String buildPrompt(AdjudicationInput input, TypologyMatch primary, String regulatoryContext) {
        Transaction txn = input.getTransaction();
        AccountStats stats = input.getStats();
        double stat = input.getStatisticalScore();
        double narrative = input.getNarrativeScore();

        String statInterpretation = stat > 5 ? "HIGH ANOMALY" : stat > 3 ? "MODERATE ANOMALY" : "LOW ANOMALY";
        String narrativeInterpretation = narrative < 0.3 ? "SEVERE BREAK"
                : narrative < 0.5 ? "SUSPICIOUS" : "MODERATE DEVIATION";

        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format(Locale.US,
                "TRANSACTION UNDER REVIEW:\n" +
                "- Amount: $%,.2f %s\n" +
                "- Payment Format: %s\n" +
                "- Date: %s\n" +
                "- Sender: Account %s at Bank %s\n" +
                "- Receiver: Account %s at Bank %s\n\n",
                txn.getAmountSent(), txn.getAmount().getCurrencySent(),
                txn.getPaymentFormat(),
                PROMPT_DATE.format(Instant.ofEpochMilli(txn.getTimestamp())),
                txn.getSender().getAccountId(), txn.getSender().getBankId(),
                txn.getReceiver().getAccountId(), txn.getReceiver().getBankId()));

        prompt.append(String.format(Locale.US,
                "STATISTICAL GATE SCORE: %.2f/10.0\n- Interpretation: %s\n\n" +
                "NARRATIVE GATE SCORE: %.2f%%\n- Interpretation: %s\n\n",
                stat, statInterpretation, narrative * 100, narrativeInterpretation));

        prompt.append(String.format(Locale.US,
                "ACCOUNT HISTORY:\n" +
                "- Total Transactions: %d\n" +
                "- Total Sent: $%,.2f\n" +
                "- Total Received: $%,.2f\n" +
                "- Avg Transaction: $%,.2f\n" +
                "- Unique Counterparties: %d\n" +
                "- Frequency: %.2f/day\n\n",
                stats.getTotalTransactions(), stats.getTotalSent(), stats.getTotalReceived(),
                stats.getAvgTransactionAmount(), stats.getUniqueCounterparties(),
                stats.getTransactionFrequencyPerDay()));

        prompt.append("TRIGGERED BY: ")
                .append(input.getTriggeredBy().getLabel().toUpperCase(Locale.ROOT))
                .append(" GATE\n\n");

        if (primary != null) {
            prompt.append("PRE-DETECTED TYPOLOGY: ").append(primary.getName()).append('\n')
                    .append(String.format(Locale.US, "- Confidence: %.0f%%\n", primary.getConfidence() * 100))
                    .append("- Signals: ").append(String.join(", ", primary.getSignalsMatched())).append("\n\n");
        } else {
            prompt.append("PRE-DETECTED TYPOLOGY: None detected\n\n");
        }

        prompt.append("REGULATORY CONTEXT:\n").append(regulatoryContext).append("\n\n")
                .append("Based on all the above, provide your decision as JSON.");
        return prompt.toString();
    }
}
