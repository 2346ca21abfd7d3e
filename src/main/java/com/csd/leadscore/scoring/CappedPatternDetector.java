package com.csd.leadscore.scoring;

import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SignalEvidence;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for detectors where every matching pattern adds a fixed increment and the sum is capped.
 */
public abstract class CappedPatternDetector implements SignalDetector {

    private final SignalComponent component;
    private final String flagName;

    protected CappedPatternDetector(SignalComponent component, String flagName) {
        this.component = component;
        this.flagName = flagName;
    }

    protected abstract PatternCatalog.PatternGroup patterns(PatternCatalog catalog);

    @Override
    public SignalEvidence detect(LeadInput input, PatternCatalog catalog) {
        PatternCatalog.PatternGroup group = patterns(catalog);
        String message = input.getMessage().toLowerCase(Locale.ROOT);
        SignalEvidence.SignalEvidenceBuilder evidence = SignalEvidence.builder().component(component);

        int sum = 0;
        boolean matched = false;
        for (Pattern pattern : group.getPatterns()) {
            Matcher m = pattern.matcher(message);
            if (m.find()) {
                sum += group.getIncrement();
                matched = true;
                evidence.matchedToken(m.group());
            }
        }

        return evidence
                .points(Math.min(sum, group.getCap()))
                .flag(flagName, matched)
                .build();
    }
}
