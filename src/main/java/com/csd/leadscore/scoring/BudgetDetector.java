package com.csd.leadscore.scoring;

import com.csd.leadscore.model.SignalComponent;

public class BudgetDetector extends CappedPatternDetector {

    public static final String FLAG_BUDGET = "has_budget";

    public BudgetDetector() {
        super(SignalComponent.BUDGET, FLAG_BUDGET);
    }

    @Override
    protected PatternCatalog.PatternGroup patterns(PatternCatalog catalog) {
        return catalog.getBudget();
    }
}
