package com.bank.aml.controller;

import com.bank.aml.config.TribunalConfig;
import com.bank.aml.model.Typology;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the tribunal's thresholds and known typologies")
public class ConfigController {

    private final TribunalConfig config;

    public ConfigController(TribunalConfig config) {
        this.config = config;
    }

    @Operation(summary = "Get gate and confidence thresholds",
            description = "Loaded at startup from configuration; read-only at runtime.")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        TribunalConfig.Thresholds t = config.getThresholds();
        TribunalConfig.Latency l = config.getLatency();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("statisticalGate", t.getStatisticalGate());
        body.put("narrativeGate", t.getNarrativeGate());
        body.put("expertConfidenceBlock", t.getExpertConfidenceBlock());
        body.put("expertConfidenceReview", t.getExpertConfidenceReview());
        body.put("pipelineTimeoutMs", l.getPipelineTimeoutMs());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "List detectable typologies")
    @GetMapping("/typologies")
    public ResponseEntity<List<Map<String, String>>> getTypologies() {
        List<Map<String, String>> typologies = new ArrayList<>();
        for (Typology typology : Typology.values()) {
            typologies.add(Map.of(
                    "name", typology.getDisplayName(),
                    "description", typology.getDescription()));
        }
        return ResponseEntity.ok(typologies);
    }
}
