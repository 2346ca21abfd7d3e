package com.csd.leadscore.scoring;

import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.SignalEvidence;

/**
 * Extracts one signal family from a lead. Implementations are stateless and must not depend on
 * any other detector's output, so detectors can run in any order.
 */
public interface SignalDetector {

    SignalEvidence detect(LeadInput input, PatternCatalog catalog);
}
