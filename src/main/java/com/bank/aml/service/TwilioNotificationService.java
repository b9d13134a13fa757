package com.bank.aml.service;

import com.bank.aml.config.ExecutorConfig;
import com.bank.aml.config.MetricsConfig;
import com.bank.aml.config.TwilioNotificationConfig;
import com.bank.aml.model.Decision;
import com.bank.aml.model.PipelineResult;
import com.bank.aml.model.Transaction;
import com.bank.aml.model.Verdict;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    /**
     * Alert the compliance desk about a BLOCK decision. Delivery failures are
     * logged and counted; they never change the decision.
     */
    @Async(ExecutorConfig.NOTIFICATION_EXECUTOR)
    @Observed(name = "notification.send", contextualName = "send-block-notification")
    public void notifyIfBlocked(Transaction txn, PipelineResult result) {
        if (!config.isEnabled() || result.getFinalDecision() != Decision.BLOCK) {
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(txn, result)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification sent for txn={}, sid={}", txn.getTxnId(), message.getSid());
        } catch (RuntimeException e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification for txn={}: {}", txn.getTxnId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(Transaction txn, PipelineResult result) {
        Verdict verdict = result.getExpertResult();
        String typology = verdict != null && verdict.getTypology() != null ? verdict.getTypology() : "N/A";

        return String.format(Locale.US,
                "[AML ALERT] Transaction BLOCKED\n" +
                "Account: %s\n" +
                "Txn ID: %s\n" +
                "Amount: %,.2f %s\n" +
                "Typology: %s\n" +
                "Confidence: %.0f%%",
                txn.getSender().getAccountId(),
                txn.getTxnId(),
                txn.getAmountSent(), txn.getAmount().getCurrencySent(),
                typology,
                result.getFinalConfidence() * 100);
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
