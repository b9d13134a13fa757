package com.bank.aml.controller;

import com.bank.aml.config.MetricsConfig;
import com.bank.aml.model.EvaluationMetrics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Detection quality against labelled transactions")
public class AnalyticsController {

    private final MetricsConfig metricsConfig;

    public AnalyticsController(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    @GetMapping("/detection-metrics")
    @Operation(summary = "Get detection metrics",
               description = "Precision, recall, F1 and accuracy of pipeline decisions for transactions " +
                       "screened with a ground-truth label since startup. Non-APPROVE counts as flagged.")
    public ResponseEntity<EvaluationMetrics> getDetectionMetrics() {
        return ResponseEntity.ok(metricsConfig.detectionMetrics());
    }
}
