package com.bank.aml.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "tribunal")
public class TribunalConfig {

    private Thresholds thresholds = new Thresholds();

    // Soft per-stage budgets; overruns are logged, not enforced. Only the pipeline timeout is a hard limit.
    private Latency latency = new Latency();

    private Report report = new Report();

    private KnowledgeBase knowledgeBase = new KnowledgeBase();

    // Threads available for concurrent adjudications.
    private int adjudicationThreads = 8;

    // Pool and backlog for BLOCK notifications.
    private int notificationThreads = 2;

    private int notificationQueueCapacity = 100;

    @Data
    public static class Thresholds {
        // Statistical score at or below this passes the first gate (0-10 scale).
        private double statisticalGate = 3.0;

        // Narrative coherence at or above this passes the second gate (0-1 scale).
        private double narrativeGate = 0.7;

        // BLOCK below this confidence is demoted to REVIEW.
        private double expertConfidenceBlock = 0.8;

        // APPROVE below this confidence is demoted to REVIEW.
        private double expertConfidenceReview = 0.5;
    }

    @Data
    public static class Latency {
        private long statisticalGateMs = 10;
        private long narrativeGateMs = 200;
        private long adjudicationMs = 3000;
        private long pipelineTimeoutMs = 5000;
    }

    @Data
    public static class Report {
        private String filingInstitution = "Handle-AI";
    }

    @Data
    public static class KnowledgeBase {
        private int contextCharsPerResult = 1500;
    }
}
