package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-party trend statistics derived from the historical share series.
 *
 * <ul>
 *   <li>{@code historicalVotes}: share series ordered by year ascending</li>
 *   <li>{@code trendSlope}: least-squares slope in percentage points per year; always finite</li>
 *   <li>{@code volatility}: sample standard deviation of the shares (≥ 0)</li>
 *   <li>{@code avgGrowthRate}: mean relative period-over-period change</li>
 * </ul>
 */
public record PartyTrendData(
    @JsonProperty("party")           String          party,
    @JsonProperty("historicalVotes") List<VoteShare> historicalVotes,
    @JsonProperty("trendSlope")      double          trendSlope,
    @JsonProperty("volatility")      double          volatility,
    @JsonProperty("avgGrowthRate")   double          avgGrowthRate
) {
    public PartyTrendData {
        historicalVotes = List.copyOf(historicalVotes);
    }

    /** Most recent entry of the share series, or {@code null} when the series is empty. */
    public VoteShare latest() {
        return historicalVotes.isEmpty() ? null : historicalVotes.get(historicalVotes.size() - 1);
    }

    public PartyTrendData withHistoricalVotes(List<VoteShare> votes) {
        return new PartyTrendData(party, votes, trendSlope, volatility, avgGrowthRate);
    }
}
