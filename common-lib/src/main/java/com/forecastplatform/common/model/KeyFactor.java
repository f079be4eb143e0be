package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyFactor(
    @JsonProperty("factor") String factor,
    @JsonProperty("impact") String impact
) {}
