package com.bank.aml.service;

import com.bank.aml.config.ExecutorConfig;
import com.bank.aml.config.TribunalConfig;
import com.bank.aml.exception.AdjudicationTimeoutException;
import com.bank.aml.exception.ExternalServiceUnavailableException;
import com.bank.aml.gate.NarrativeGate;
import com.bank.aml.gate.StatisticalGate;
import com.bank.aml.model.AccountHistory;
import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Decision;
import com.bank.aml.model.LayerResult;
import com.bank.aml.model.NarrativeGateResult;
import com.bank.aml.model.PipelineLayer;
import com.bank.aml.model.PipelineResult;
import com.bank.aml.model.StatisticalGateResult;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.TriggerReason;
import com.bank.aml.model.Verdict;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sequences the two gates and, when both flag a transaction, the adjudicator.
 *
 * INIT -> STATISTICAL -> {APPROVE | NARRATIVE} -> {APPROVE | ADJUDICATE}
 *
 * Produces a result record and nothing else; persistence, metrics and alerts
 * belong to {@link ScreeningService}. Collaborator failures propagate.
 */
@Service
public class GatePipeline {

    private static final Logger log = LoggerFactory.getLogger(GatePipeline.class);

    private final StatisticalGate statisticalGate;
    private final NarrativeGate narrativeGate;
    private final VerdictAdjudicator adjudicator;
    private final PipelineInputValidator validator;
    private final TribunalConfig config;
    private final ExecutorService adjudicationExecutor;

    public GatePipeline(StatisticalGate statisticalGate,
                        NarrativeGate narrativeGate,
                        VerdictAdjudicator adjudicator,
                        PipelineInputValidator validator,
                        TribunalConfig config,
                        @Qualifier(ExecutorConfig.ADJUDICATION_EXECUTOR) ExecutorService adjudicationExecutor) {
        this.statisticalGate = statisticalGate;
        this.narrativeGate = narrativeGate;
        this.adjudicator = adjudicator;
        this.validator = validator;
        this.config = config;
        this.adjudicationExecutor = adjudicationExecutor;
    }

    /**
     * Process a transaction under the configured default timeout.
     */
    public PipelineResult process(Transaction txn, AccountHistory history) {
        return process(txn, history, Deadline.after(Duration.ofMillis(config.getLatency().getPipelineTimeoutMs())));
    }

    @Observed(name = "pipeline.process", contextualName = "process-transaction")
    public PipelineResult process(Transaction txn, AccountHistory history, Deadline deadline) {
        validator.validateInputs(txn, history);

        long startNanos = System.nanoTime();
        String txnId = txn.getTxnId();
        TribunalConfig.Latency latency = config.getLatency();

        // Statistical gate
        ensureTimeLeft(deadline, txnId, "statistical gate");
        long stageStart = System.nanoTime();
        StatisticalGateResult stat = statisticalGate.analyze(txn, history);
        double statMs = elapsedMs(stageStart);
        validator.validateStatistical(stat);
        warnIfOverBudget(txnId, "statistical gate", statMs, latency.getStatisticalGateMs());

        Map<String, Object> statDetails = new LinkedHashMap<>(stat.getDetails());
        statDetails.put("clusterId", stat.getClusterId());
        statDetails.put("zScore", stat.getZScore());
        LayerResult statLayer = LayerResult.builder()
                .layer(PipelineLayer.STATISTICAL)
                .score(stat.getScore())
                .passed(stat.isPassed())
                .processingTimeMs(statMs)
                .details(statDetails)
                .build();

        if (stat.isPassed()) {
            log.debug("Txn {} approved at statistical gate (score={})", txnId, stat.getScore());
            return result(txnId, statLayer, null, null, Decision.APPROVE, 1.0 - stat.getScore() / 10.0,
                    List.of(PipelineLayer.STATISTICAL), startNanos);
        }

        // Narrative gate
        ensureTimeLeft(deadline, txnId, "narrative gate");
        stageStart = System.nanoTime();
        NarrativeGateResult narrative = narrativeGate.analyze(txn, history);
        double narrativeMs = elapsedMs(stageStart);
        validator.validateNarrative(narrative);
        warnIfOverBudget(txnId, "narrative gate", narrativeMs, latency.getNarrativeGateMs());

        LayerResult narrativeLayer = LayerResult.builder()
                .layer(PipelineLayer.NARRATIVE)
                .score(narrative.getScore())
                .passed(narrative.isPassed())
                .processingTimeMs(narrativeMs)
                .details(narrative.getDetails())
                .build();

        if (narrative.isPassed()) {
            log.debug("Txn {} approved at narrative gate (score={})", txnId, narrative.getScore());
            return result(txnId, statLayer, narrativeLayer, null, Decision.APPROVE, narrative.getScore(),
                    List.of(PipelineLayer.STATISTICAL, PipelineLayer.NARRATIVE), startNanos);
        }

        // Adjudication
        TriggerReason trigger = TriggerReason.attribute(stat.isPassed(), narrative.isPassed());
        AdjudicationInput input = AdjudicationInput.builder()
                .transaction(txn)
                .statisticalScore(stat.getScore())
                .narrativeScore(narrative.getScore())
                .accountHistory(history)
                .triggeredBy(trigger)
                .build();

        log.info("Escalating txn {} to adjudication (stat={}, narrative={}, trigger={})",
                txnId, stat.getScore(), narrative.getScore(), trigger.getLabel());

        ensureTimeLeft(deadline, txnId, "adjudication");
        stageStart = System.nanoTime();
        Verdict verdict = adjudicate(input, deadline);
        warnIfOverBudget(txnId, "adjudication", elapsedMs(stageStart), latency.getAdjudicationMs());

        return result(txnId, statLayer, narrativeLayer, verdict, verdict.getDecision(), verdict.getConfidence(),
                List.of(PipelineLayer.STATISTICAL, PipelineLayer.NARRATIVE, PipelineLayer.EXPERT), startNanos);
    }

    private Verdict adjudicate(AdjudicationInput input, Deadline deadline) {
        if (!deadline.isBounded()) {
            return adjudicator.adjudicate(input);
        }

        String txnId = input.getTransaction().getTxnId();
        Future<Verdict> future = adjudicationExecutor.submit(() -> adjudicator.adjudicate(input));
        try {
            return future.get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Adjudication of txn {} cancelled after {} ms deadline", txnId, deadline.getBudget().toMillis());
            throw new AdjudicationTimeoutException(txnId, "adjudication", deadline.getBudget());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalServiceUnavailableException("tribunal", "interrupted while adjudicating " + txnId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ExternalServiceUnavailableException("tribunal", "adjudication failed for " + txnId, cause);
        }
    }

    private void ensureTimeLeft(Deadline deadline, String txnId, String stage) {
        if (deadline.isExpired()) {
            log.warn("Deadline expired before {} for txn {}", stage, txnId);
            throw new AdjudicationTimeoutException(txnId, stage, deadline.getBudget());
        }
    }

    private void warnIfOverBudget(String txnId, String stage, double elapsedMs, long budgetMs) {
        if (elapsedMs > budgetMs) {
            log.warn("{} for txn {} took {} ms, over its {} ms budget",
                    stage, txnId, String.format("%.1f", elapsedMs), budgetMs);
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static PipelineResult result(String txnId, LayerResult stat, LayerResult narrative, Verdict verdict,
                                         Decision decision, double confidence, List<PipelineLayer> layers,
                                         long startNanos) {
        return PipelineResult.builder()
                .transactionId(txnId)
                .statisticalResult(stat)
                .narrativeResult(narrative)
                .expertResult(verdict)
                .finalDecision(decision)
                .finalConfidence(confidence)
                .totalProcessingTimeMs(elapsedMs(startNanos))
                .layersInvoked(layers)
                .evaluatedAt(System.currentTimeMillis())
                .build();
    }
}
