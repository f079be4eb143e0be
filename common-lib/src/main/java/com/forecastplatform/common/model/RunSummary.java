package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Poll view of a run: its current row, the top party results and its swing regions. */
public record RunSummary(
    @JsonProperty("run")          ForecastRun                run,
    @JsonProperty("topParties")   List<ForecastResultRecord> topParties,
    @JsonProperty("swingRegions") List<SwingRegionRecord>    swingRegions
) {}
