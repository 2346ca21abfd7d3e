package com.csd.leadscore.scoring;

import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SignalEvidence;

import java.util.Locale;
import java.util.Map;

/**
 * Sums the signed weight of every catalog keyword found in the message. All hits count; there
 * is no short-circuit after the first match.
 */
public class KeywordSentimentDetector implements SignalDetector {

    @Override
    public SignalEvidence detect(LeadInput input, PatternCatalog catalog) {
        String message = input.getMessage().toLowerCase(Locale.ROOT);
        SignalEvidence.SignalEvidenceBuilder evidence = SignalEvidence.builder().component(SignalComponent.KEYWORD);

        int score = 0;
        score += accumulate(message, catalog.getHighKeywords(), evidence);
        score += accumulate(message, catalog.getMediumKeywords(), evidence);
        score += accumulate(message, catalog.getNegativeKeywords(), evidence);

        return evidence.points(score).build();
    }

    private int accumulate(String message, Map<String, Integer> weights, SignalEvidence.SignalEvidenceBuilder evidence) {
        int sum = 0;
        for (Map.Entry<String, Integer> entry : weights.entrySet()) {
            if (message.contains(entry.getKey())) {
                int weight = entry.getValue();
                sum += weight;
                evidence.matchedToken(String.format("%+d (%s)", weight, entry.getKey()));
            }
        }
        return sum;
    }
}
