package com.csd.leadscore.scoring;

import com.csd.leadscore.model.SignalComponent;

public class UrgencyDetector extends CappedPatternDetector {

    public static final String FLAG_URGENT = "is_urgent";

    public UrgencyDetector() {
        super(SignalComponent.URGENCY, FLAG_URGENT);
    }

    @Override
    protected PatternCatalog.PatternGroup patterns(PatternCatalog catalog) {
        return catalog.getUrgency();
    }
}
