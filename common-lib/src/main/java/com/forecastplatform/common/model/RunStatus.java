package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a {@link ForecastRun}: {@code pending → running → completed | failed}.
 * {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum RunStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String label;

    RunStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
