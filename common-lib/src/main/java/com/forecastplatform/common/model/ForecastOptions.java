package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scope of a single forecast execution. {@code historicalYears} and
 * {@code modelParameters} are optional; when absent the orchestrator derives
 * the year window from {@code targetYear} and uses the configured defaults.
 */
public record ForecastOptions(
    @JsonProperty("targetYear")      int                     targetYear,
    @JsonProperty("targetPosition")  String                  targetPosition,
    @JsonProperty("targetState")     String                  targetState,
    @JsonProperty("historicalYears") List<Integer>           historicalYears,
    @JsonProperty("modelParameters") ModelParameterOverrides modelParameters
) {
    public static ForecastOptions forYear(int targetYear) {
        return new ForecastOptions(targetYear, null, null, null, null);
    }
}
