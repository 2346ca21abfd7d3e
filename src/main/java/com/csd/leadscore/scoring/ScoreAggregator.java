package com.csd.leadscore.scoring;

import com.csd.leadscore.model.ScoreBreakdown;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SignalEvidence;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines detector evidence into the final score:
 * {@code clamp(0, 100, round((base + keyword + role + urgency + budget + scale) * multiplier))}.
 * The multiplier applies to the whole sum; rounding happens once, before clamping.
 */
public class ScoreAggregator {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public ScoreBreakdown aggregate(int baseScore, List<SignalEvidence> signals) {
        Map<SignalComponent, Integer> points = new EnumMap<>(SignalComponent.class);
        BigDecimal multiplier = BigDecimal.ONE;
        for (SignalEvidence signal : signals) {
            points.merge(signal.getComponent(), signal.getPoints(), Integer::sum);
            if (signal.getComponent() == SignalComponent.COMPANY_SIZE) {
                multiplier = signal.getMultiplier();
            }
        }

        ScoreBreakdown.ScoreBreakdownBuilder breakdown = ScoreBreakdown.builder()
                .base(baseScore)
                .keyword(points.getOrDefault(SignalComponent.KEYWORD, 0))
                .role(points.getOrDefault(SignalComponent.ROLE, 0))
                .urgency(points.getOrDefault(SignalComponent.URGENCY, 0))
                .budget(points.getOrDefault(SignalComponent.BUDGET, 0))
                .scale(points.getOrDefault(SignalComponent.SCALE, 0))
                .sizeMultiplier(multiplier);

        int total = breakdown.build().preMultiplierTotal();
        return breakdown.finalScore(finalScore(total, multiplier)).build();
    }

    static int finalScore(int preMultiplierTotal, BigDecimal multiplier) {
        BigDecimal scaled = BigDecimal.valueOf(preMultiplierTotal)
                .multiply(multiplier)
                .setScale(0, RoundingMode.HALF_UP);
        return clamp(scaled);
    }

    private static int clamp(BigDecimal value) {
        if (value.compareTo(BigDecimal.valueOf(MIN_SCORE)) < 0) {
            return MIN_SCORE;
        }
        if (value.compareTo(BigDecimal.valueOf(MAX_SCORE)) > 0) {
            return MAX_SCORE;
        }
        return value.intValueExact();
    }
}
