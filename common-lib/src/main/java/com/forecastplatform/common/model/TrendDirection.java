package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Directional classification of a party's vote-share trend.
 */
public enum TrendDirection {
    RISING("rising"),
    FALLING("falling"),
    STABLE("stable");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
