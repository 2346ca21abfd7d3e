package com.csd.leadscore.model;

public enum RoleTier {
    EXECUTIVE("Executive"),
    DECISION_MAKER("Decision Maker"),
    STANDARD("Standard");

    private final String label;

    RoleTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RoleTier fromLabel(String label) {
        for (RoleTier tier : values()) {
            if (tier.label.equals(label)) {
                return tier;
            }
        }
        return STANDARD;
    }
}
