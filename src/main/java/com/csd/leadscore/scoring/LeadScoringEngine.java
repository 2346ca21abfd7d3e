package com.csd.leadscore.scoring;

import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.Priority;
import com.csd.leadscore.model.ScoreBreakdown;
import com.csd.leadscore.model.ScoredLead;
import com.csd.leadscore.model.SignalEvidence;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic lead scorer. Runs every detector against the lead, aggregates, classifies and
 * writes a justification. Holds no mutable state and is safe to share between threads.
 */
@Slf4j
public class LeadScoringEngine {

    private final PatternCatalog catalog;
    private final List<SignalDetector> detectors;
    private final ScoreAggregator aggregator;
    private final JustificationSynthesizer synthesizer;

    public LeadScoringEngine(PatternCatalog catalog) {
        this(catalog, defaultDetectors(), new ScoreAggregator(), new JustificationSynthesizer());
    }

    public LeadScoringEngine(PatternCatalog catalog,
                             List<SignalDetector> detectors,
                             ScoreAggregator aggregator,
                             JustificationSynthesizer synthesizer) {
        this.catalog = catalog;
        this.detectors = List.copyOf(detectors);
        this.aggregator = aggregator;
        this.synthesizer = synthesizer;
    }

    public static List<SignalDetector> defaultDetectors() {
        return List.of(
                new KeywordSentimentDetector(),
                new RoleTierDetector(),
                new CompanySizeDetector(),
                new UrgencyDetector(),
                new BudgetDetector(),
                new ScaleDetector());
    }

    public ScoredLead score(String role, String companySize, String message) {
        return score(LeadInput.of(role, companySize, message));
    }

    public ScoredLead score(LeadInput input) {
        List<SignalEvidence> signals = new ArrayList<>(detectors.size());
        for (SignalDetector detector : detectors) {
            SignalEvidence evidence = detector.detect(input, catalog);
            log.debug("{} -> {} points, multiplier {}, tokens {}", evidence.getComponent(),
                    evidence.getPoints(), evidence.getMultiplier(), evidence.getMatchedTokens());
            signals.add(evidence);
        }

        ScoreBreakdown breakdown = aggregator.aggregate(catalog.getBaseScore(), signals);
        int score = breakdown.getFinalScore();
        Priority priority = PriorityClassifier.classify(score);

        return ScoredLead.builder()
                .score(score)
                .priority(priority)
                .justification(synthesizer.synthesize(signals, score))
                .breakdown(breakdown)
                .signals(signals)
                .build();
    }

    public PatternCatalog getCatalog() {
        return catalog;
    }
}
