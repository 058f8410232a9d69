package com.typepulse.processing.keyboard;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Hand {
    LEFT("left"),
    RIGHT("right"),
    // space bar, struck by either thumb
    BOTH("both");

    private final String label;

    Hand(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
