package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Chart-ready copy of a party's share series: parallel lists of years and shares.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoricalTrend(
    @JsonProperty("years")      List<Integer> years,
    @JsonProperty("voteShares") List<Double>  voteShares
) {
    public static HistoricalTrend of(List<VoteShare> series) {
        return new HistoricalTrend(
            series.stream().map(VoteShare::year).toList(),
            series.stream().map(VoteShare::share).toList());
    }
}
