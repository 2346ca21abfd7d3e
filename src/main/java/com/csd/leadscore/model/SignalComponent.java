package com.csd.leadscore.model;

public enum SignalComponent {
    KEYWORD,        // message keyword sentiment
    ROLE,           // role tier
    COMPANY_SIZE,   // size multiplier, no additive points
    URGENCY,
    BUDGET,
    SCALE
}
