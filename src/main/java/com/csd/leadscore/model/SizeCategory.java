package com.csd.leadscore.model;

import java.math.BigDecimal;

public enum SizeCategory {
    ENTERPRISE("Enterprise"),
    MID_MARKET("Mid-Market"),
    SMALL_BUSINESS("Small Business");

    private static final BigDecimal ENTERPRISE_FLOOR = new BigDecimal("1.4");

    private final String label;

    SizeCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SizeCategory fromMultiplier(BigDecimal multiplier) {
        if (multiplier.compareTo(ENTERPRISE_FLOOR) >= 0) {
            return ENTERPRISE;
        }
        if (multiplier.compareTo(BigDecimal.ONE) >= 0) {
            return MID_MARKET;
        }
        return SMALL_BUSINESS;
    }

    public static SizeCategory fromLabel(String label) {
        for (SizeCategory category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        return MID_MARKET;
    }
}
