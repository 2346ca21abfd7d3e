package com.csd.leadscore.scoring;

import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SignalEvidence;
import com.csd.leadscore.model.SizeCategory;

import java.math.BigDecimal;

/**
 * Looks up the size multiplier. The size category is for display only; it adds no points.
 */
public class CompanySizeDetector implements SignalDetector {

    public static final String FLAG_KNOWN_SIZE = "known_size";

    @Override
    public SignalEvidence detect(LeadInput input, PatternCatalog catalog) {
        String size = input.getCompanySize().trim();
        boolean known = catalog.getSizeMultipliers().containsKey(size);
        BigDecimal multiplier = catalog.multiplierFor(size);

        SignalEvidence.SignalEvidenceBuilder builder = SignalEvidence.builder()
                .component(SignalComponent.COMPANY_SIZE)
                .points(0)
                .multiplier(multiplier)
                .label(SizeCategory.fromMultiplier(multiplier).label())
                .flag(FLAG_KNOWN_SIZE, known);
        if (known) {
            builder.matchedToken(size);
        }
        return builder.build();
    }
}
