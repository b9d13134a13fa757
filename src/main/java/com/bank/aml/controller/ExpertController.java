package com.bank.aml.controller;

import com.bank.aml.exception.InvariantViolationException;
import com.bank.aml.model.AdvisorAnswer;
import com.bank.aml.model.AdvisorQuestion;
import com.bank.aml.model.KnowledgeDocument;
import com.bank.aml.service.ComplianceAdvisorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/expert")
@Tag(name = "Expert", description = "Ask the compliance advisor and search the regulatory knowledge base")
public class ExpertController {

    private final ComplianceAdvisorService advisorService;

    public ExpertController(ComplianceAdvisorService advisorService) {
        this.advisorService = advisorService;
    }

    @Operation(summary = "Ask a compliance question",
            description = "Answers from regulatory passages retrieved for the question, optionally limited to one source.")
    @PostMapping("/ask")
    public ResponseEntity<AdvisorAnswer> ask(@RequestBody AdvisorQuestion question) {
        if (question.getQuestion() == null || question.getQuestion().isBlank()) {
            throw new InvariantViolationException("question", "must not be blank");
        }
        return ResponseEntity.ok(advisorService.ask(question.getQuestion(), question.getSource()));
    }

    @Operation(summary = "Search the regulatory knowledge base")
    @GetMapping("/search")
    public ResponseEntity<List<KnowledgeDocument>> search(
            @Parameter(description = "Search text", example = "structuring red flags")
            @RequestParam String query,
            @Parameter(description = "Max number of passages", example = "5")
            @RequestParam(defaultValue = "5") int limit) {
        if (limit <= 0) {
            throw new InvariantViolationException("limit", "must be positive but was " + limit);
        }
        return ResponseEntity.ok(advisorService.search(query, limit));
    }
}
