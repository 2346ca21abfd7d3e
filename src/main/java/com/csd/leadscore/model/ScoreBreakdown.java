package com.csd.leadscore.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ScoreBreakdown {
    int base;
    int keyword;
    int role;
    int urgency;
    int budget;
    int scale;
    BigDecimal sizeMultiplier;
    int finalScore;

    public int preMultiplierTotal() {
        return base + keyword + role + urgency + budget + scale;
    }
}
