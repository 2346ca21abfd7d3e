package com.csd.leadscore.scoring;

import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SignalEvidence;

import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Finds a deployment size such as "500 users". Unit families are tried in catalog order and
 * only the first family that matches is used, even when its number falls below every tier.
 */
public class ScaleDetector implements SignalDetector {

    public static final String UNKNOWN_SCALE = "Unknown scale";

    @Override
    public SignalEvidence detect(LeadInput input, PatternCatalog catalog) {
        String message = input.getMessage().toLowerCase(Locale.ROOT);
        SignalEvidence.SignalEvidenceBuilder evidence = SignalEvidence.builder()
                .component(SignalComponent.SCALE)
                .points(0)
                .label(UNKNOWN_SCALE);

        for (PatternCatalog.ScaleFamily family : catalog.getScaleFamilies()) {
            Matcher m = family.getPattern().matcher(message);
            if (!m.find()) {
                continue;
            }
            evidence.matchedToken(m.group());
            int number = parseCount(m.group(1));
            for (PatternCatalog.ScaleTier tier : catalog.getScaleTiers()) {
                if (number >= tier.getMinimum()) {
                    evidence.points(tier.getPoints())
                            .label(String.format("%s (%d+ %s)", tier.getLabel(), number, family.getUnit()))
                            .flag(tier.getName(), true);
                    break;
                }
            }
            break;
        }
        return evidence.build();
    }

    private int parseCount(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // digits only, so this is overflow
            return Integer.MAX_VALUE;
        }
    }
}
