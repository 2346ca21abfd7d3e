package com.csd.leadscore.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority buckets, ordered from highest to lowest floor.
 */
public enum Priority {
    HIGH(80, "High Priority", "red"),
    MEDIUM(40, "Medium Priority", "orange"),
    LOW(1, "Low Priority", "blue"),
    JUNK(0, "Junk/Error", "gray");

    private final int floor;
    private final String label;
    private final String color;

    Priority(int floor, String label, String color) {
        this.floor = floor;
        this.label = label;
        this.color = color;
    }

    public int floor() {
        return floor;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String color() {
        return color;
    }
}
