package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InfluenceFactor(
    @JsonProperty("factor") String factor,
    @JsonProperty("weight") double weight,
    @JsonProperty("impact") String impact
) {}
