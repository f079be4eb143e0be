package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a {@link ForecastRun}. Only non-null fields are applied by the store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastRunUpdate(
    @JsonProperty("status")              RunStatus       status,
    @JsonProperty("startedAt")           Instant         startedAt,
    @JsonProperty("completedAt")         Instant         completedAt,
    @JsonProperty("totalSimulations")    Integer         totalSimulations,
    @JsonProperty("historicalYearsUsed") List<Integer>   historicalYearsUsed,
    @JsonProperty("modelParameters")     ModelParameters modelParameters,
    @JsonProperty("narrative")           String          narrative
) {
    public static ForecastRunUpdate running(Instant at) {
        return new ForecastRunUpdate(RunStatus.RUNNING, at, null, null, null, null, null);
    }

    public static ForecastRunUpdate failed(Instant at) {
        return new ForecastRunUpdate(RunStatus.FAILED, null, at, null, null, null, null);
    }

    public static ForecastRunUpdate completed(Instant at, int totalSimulations, List<Integer> yearsUsed,
                                              ModelParameters parameters, String narrative) {
        return new ForecastRunUpdate(RunStatus.COMPLETED, null, at, totalSimulations,
            List.copyOf(yearsUsed), parameters, narrative);
    }
}
