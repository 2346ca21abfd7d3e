package com.csd.leadscore.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Output of one detector run. Additive detectors report {@code points}; the company size
 * detector reports a {@code multiplier} and zero points.
 */
@Value
@Builder
public class SignalEvidence {
    SignalComponent component;
    int points;
    @Builder.Default
    BigDecimal multiplier = BigDecimal.ONE;
    String label;
    @Singular
    List<String> matchedTokens;
    @Singular
    Map<String, Boolean> flags;

    public boolean flag(String name) {
        return Boolean.TRUE.equals(flags.get(name));
    }
}
