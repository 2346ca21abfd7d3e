package com.csd.leadscore.scoring;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Read-only keyword tables, role lists, size multipliers and structural patterns used by the
 * signal detectors. Built once by {@link PatternCatalogLoader}; all collections are unmodifiable.
 */
@Value
@Builder
public class PatternCatalog {

    int baseScore;

    Map<String, Integer> highKeywords;
    Map<String, Integer> mediumKeywords;
    Map<String, Integer> negativeKeywords;

    List<String> executiveRoles;
    int executiveRoleScore;
    List<String> decisionMakerRoles;
    int decisionMakerRoleScore;
    int defaultRoleScore;

    Map<String, BigDecimal> sizeMultipliers;
    BigDecimal defaultSizeMultiplier;

    PatternGroup urgency;
    PatternGroup budget;

    List<ScaleFamily> scaleFamilies;
    /** Descending by minimum. */
    List<ScaleTier> scaleTiers;

    public BigDecimal multiplierFor(String companySize) {
        if (companySize == null) {
            return defaultSizeMultiplier;
        }
        return sizeMultipliers.getOrDefault(companySize.trim(), defaultSizeMultiplier);
    }

    /**
     * Patterns that each add {@code increment} points when found, summed and capped at {@code cap}.
     */
    @Value
    public static class PatternGroup {
        List<Pattern> patterns;
        int increment;
        int cap;
    }

    /**
     * A {@code <number> <unit>} pattern; group 1 must capture the number.
     */
    @Value
    public static class ScaleFamily {
        String unit;
        Pattern pattern;
    }

    @Value
    public static class ScaleTier {
        String name;
        int minimum;
        int points;
        String label;
    }
}
