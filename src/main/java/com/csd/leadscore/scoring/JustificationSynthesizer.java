package com.csd.leadscore.scoring;

import com.csd.leadscore.model.Priority;
import com.csd.leadscore.model.RoleTier;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SignalEvidence;
import com.csd.leadscore.model.SizeCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a short justification from evidence. Phrases are picked in a fixed order (role,
 * urgency, budget, scale, company size) and at most four are kept. Without any qualifying
 * evidence a generic phrase is chosen by the score's priority band.
 */
public class JustificationSynthesizer {

    static final int MAX_PHRASES = 4;

    static final String MODERATE_FIT = "Moderate fit, some positive signals";
    static final String LOW_FIT = "Low fit, limited positive signals";
    static final String POOR_FIT = "Poor fit or spam indicators";

    public String synthesize(List<SignalEvidence> signals, int score) {
        List<String> phrases = new ArrayList<>();

        for (SignalEvidence signal : signals) {
            if (signal.getComponent() != SignalComponent.ROLE) continue;
            RoleTier tier = RoleTier.fromLabel(signal.getLabel());
            if (tier == RoleTier.EXECUTIVE) {
                phrases.add("C-suite authority");
            } else if (tier == RoleTier.DECISION_MAKER) {
                phrases.add("Decision maker role");
            }
        }
        if (anyFlag(signals, SignalComponent.URGENCY, UrgencyDetector.FLAG_URGENT)) {
            phrases.add("urgent signals");
        }
        if (anyFlag(signals, SignalComponent.BUDGET, BudgetDetector.FLAG_BUDGET)) {
            phrases.add("budget mentioned");
        }
        if (anyFlag(signals, SignalComponent.SCALE, "enterprise")) {
            phrases.add("enterprise scale");
        } else if (anyFlag(signals, SignalComponent.SCALE, "mid-market")) {
            phrases.add("mid-market scale");
        }
        for (SignalEvidence signal : signals) {
            if (signal.getComponent() == SignalComponent.COMPANY_SIZE
                    && SizeCategory.fromLabel(signal.getLabel()) == SizeCategory.ENTERPRISE) {
                phrases.add("large company");
            }
        }

        if (!phrases.isEmpty()) {
            return String.join(", ", phrases.subList(0, Math.min(MAX_PHRASES, phrases.size())));
        }
        return fallback(score);
    }

    private boolean anyFlag(List<SignalEvidence> signals, SignalComponent component, String flag) {
        return signals.stream().anyMatch(s -> s.getComponent() == component && s.flag(flag));
    }

    private String fallback(int score) {
        Priority priority = PriorityClassifier.classify(score);
        return switch (priority) {
            case HIGH, MEDIUM -> MODERATE_FIT;
            case LOW -> LOW_FIT;
            case JUNK -> POOR_FIT;
        };
    }
}
