package com.csd.leadscore.controller;

import com.csd.leadscore.model.BatchScoreRequest;
import com.csd.leadscore.model.BatchScoreResponse;
import com.csd.leadscore.model.LeadScoreRequest;
import com.csd.leadscore.model.LeadScoreResponse;
import com.csd.leadscore.model.ScoredLead;
import com.csd.leadscore.scoring.PatternCatalog;
import com.csd.leadscore.service.LeadScoringService;
import com.csd.leadscore.service.LeadAssistant;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class ScoreController {

    private final LeadScoringService scoringService;
    private final PatternCatalog catalog;
    private final LeadAssistant assistant;

    public ScoreController(LeadScoringService scoringService,
                           PatternCatalog catalog,
                           @Qualifier("llmLeadAssistant") LeadAssistant assistant) {
        this.scoringService = scoringService;
        this.catalog = catalog;
        this.assistant = assistant;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", LocalDateTime.now());
        health.put("catalogLoaded", catalog != null);
        health.put("assistantEnabled", assistant.isAvailable());
        return health;
    }

    @PostMapping("/score")
    public LeadScoreResponse score(@Valid @RequestBody LeadScoreRequest request) {
        return scoringService.score(request);
    }

    /**
     * Full result including the score breakdown and per-detector evidence.
     */
    @PostMapping("/score/explain")
    public ScoredLead explain(@Valid @RequestBody LeadScoreRequest request) {
        return scoringService.explain(request);
    }

    @PostMapping("/score/batch")
    public BatchScoreResponse scoreBatch(@RequestBody BatchScoreRequest request) {
        return scoringService.scoreBatch(request.getLeads());
    }

    @GetMapping("/catalog")
    public Map<String, Object> catalogSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("baseScore", catalog.getBaseScore());
        summary.put("highKeywords", catalog.getHighKeywords().size());
        summary.put("mediumKeywords", catalog.getMediumKeywords().size());
        summary.put("negativeKeywords", catalog.getNegativeKeywords().size());
        summary.put("executiveRoles", catalog.getExecutiveRoles());
        summary.put("decisionMakerRoles", catalog.getDecisionMakerRoles());
        summary.put("sizeMultipliers", catalog.getSizeMultipliers());
        summary.put("defaultSizeMultiplier", catalog.getDefaultSizeMultiplier());
        return summary;
    }
}
