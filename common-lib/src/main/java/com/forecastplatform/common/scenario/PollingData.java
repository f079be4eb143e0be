package com.forecastplatform.common.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One opinion-poll figure for a party. {@code source} is optional. */
public record PollingData(
    @JsonProperty("party")       String party,
    @JsonProperty("pollPercent") double pollPercent,
    @JsonProperty("source")      String source
) {}
