package com.forecastplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forecastplatform.common.scenario.PredictionScenario;

public record ScenarioForecastRequest(
    @JsonProperty("description") String             description,
    @JsonProperty("scenario")    PredictionScenario scenario
) {}
