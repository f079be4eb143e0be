package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One historical vote tally row as returned by the historical-data source:
 * the total votes a party received in a given election year, optionally
 * scoped to a region (state code) and a contested position.
 *
 * <p>Read-only input of the forecasting pipeline. {@code region} and
 * {@code position} are nullable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoricalDataPoint(
    @JsonProperty("year")           int    year,
    @JsonProperty("party")          String party,
    @JsonProperty("region")         String region,
    @JsonProperty("position")       String position,
    @JsonProperty("totalVotes")     long   totalVotes,
    @JsonProperty("candidateCount") int    candidateCount
) {}
