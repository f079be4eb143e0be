package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a completed run: the persisted party results and swing regions
 * plus the narrative (generated or fallback).
 */
public record ForecastSummary(
    @JsonProperty("partyResults") List<ForecastResultRecord> partyResults,
    @JsonProperty("swingRegions") List<SwingRegionRecord>    swingRegions,
    @JsonProperty("narrative")    String                     narrative
) {}
