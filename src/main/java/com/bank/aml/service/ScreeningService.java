package com.bank.aml.service;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.model.AccountHistory;
import com.bank.aml.model.Decision;
import com.bank.aml.model.PipelineResult;
import com.bank.aml.model.Transaction;
import com.bank.aml.repository.PipelineResultRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for screening a transaction.
 *
 * Flow:
 * 1. Run the gate pipeline under the caller's deadline
 * 2. Persist the pipeline result
 * 3. Record metrics, including the labelled outcome when ground truth is known
 * 4. Send a notification if blocked (async, does not delay the response)
 * 5. Return the result (APPROVE / REVIEW / BLOCK)
 */
@Service
public class ScreeningService {

    private static final Logger log = LoggerFactory.getLogger(ScreeningService.class);

    private final GatePipeline gatePipeline;
    private final PipelineResultRepository resultRepository;
    private final MetricsConfig metricsConfig;
    private final TwilioNotificationService notificationService;

    public ScreeningService(GatePipeline gatePipeline,
                            PipelineResultRepository resultRepository,
                            MetricsConfig metricsConfig,
                            TwilioNotificationService notificationService) {
        this.gatePipeline = gatePipeline;
        this.resultRepository = resultRepository;
        this.metricsConfig = metricsConfig;
        this.notificationService = notificationService;
    }

    @Observed(name = "transaction.screen", contextualName = "screen-transaction")
    public PipelineResult screen(Transaction txn, AccountHistory history, Deadline deadline) {
        PipelineResult result = gatePipeline.process(txn, history, deadline);

        resultRepository.save(result);

        metricsConfig.recordPipelineDecision(result.getFinalDecision().name(),
                result.getExitLayer().getLabel(), result.getFinalConfidence());

        if (txn.getIsLaundering() != null) {
            metricsConfig.recordLabelledOutcome(result.getFinalDecision() != Decision.APPROVE,
                    txn.getIsLaundering());
        }

        notificationService.notifyIfBlocked(txn, result);

        if (result.getFinalDecision() != Decision.APPROVE) {
            log.warn("Suspicious activity for account={}, txn={}: decision={}, confidence={}, typology={}",
                    history.getAccountId(), txn.getTxnId(), result.getFinalDecision(),
                    result.getFinalConfidence(),
                    result.getExpertResult() != null ? result.getExpertResult().getTypology() : null);
        }

        return result;
    }

    public Optional<PipelineResult> findResult(String txnId) {
        return resultRepository.findByTxnId(txnId);
    }
}
