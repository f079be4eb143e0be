package com.forecastplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forecastplatform.common.model.ForecastOptions;
import com.forecastplatform.common.model.ModelParameterOverrides;

import java.util.List;

public record CreateForecastRequest(
    @JsonProperty("name")               String                  name,
    @JsonProperty("description")        String                  description,
    @JsonProperty("targetYear")         int                     targetYear,
    @JsonProperty("targetPosition")     String                  targetPosition,
    @JsonProperty("targetState")        String                  targetState,
    @JsonProperty("targetElectionType") String                  targetElectionType,
    @JsonProperty("historicalYears")    List<Integer>           historicalYears,
    @JsonProperty("modelParameters")    ModelParameterOverrides modelParameters
) {
    public ForecastOptions toOptions() {
        return new ForecastOptions(targetYear, targetPosition, targetState, historicalYears, modelParameters);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "Forecast " + targetYear : name;
    }
}
