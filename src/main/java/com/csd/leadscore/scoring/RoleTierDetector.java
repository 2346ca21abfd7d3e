package com.csd.leadscore.scoring;

import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.RoleTier;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SignalEvidence;

import java.util.List;
import java.util.Locale;

/**
 * Classifies the role into a single tier. Executive keywords are checked before decision-maker
 * keywords and the first hit wins.
 */
public class RoleTierDetector implements SignalDetector {

    @Override
    public SignalEvidence detect(LeadInput input, PatternCatalog catalog) {
        String role = input.getRole().toLowerCase(Locale.ROOT);

        String executive = firstMatch(role, catalog.getExecutiveRoles());
        if (executive != null) {
            return evidence(RoleTier.EXECUTIVE, catalog.getExecutiveRoleScore(), executive);
        }
        String decisionMaker = firstMatch(role, catalog.getDecisionMakerRoles());
        if (decisionMaker != null) {
            return evidence(RoleTier.DECISION_MAKER, catalog.getDecisionMakerRoleScore(), decisionMaker);
        }
        return evidence(RoleTier.STANDARD, catalog.getDefaultRoleScore(), null);
    }

    private String firstMatch(String role, List<String> keywords) {
        for (String keyword : keywords) {
            if (role.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private SignalEvidence evidence(RoleTier tier, int points, String keyword) {
        SignalEvidence.SignalEvidenceBuilder builder = SignalEvidence.builder()
                .component(SignalComponent.ROLE)
                .points(points)
                .label(tier.label());
        if (keyword != null) {
            builder.matchedToken(keyword);
        }
        return builder.build();
    }
}
