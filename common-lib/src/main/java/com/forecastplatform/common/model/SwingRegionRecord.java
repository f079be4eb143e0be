package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A region flagged as contested: the two leading parties are close and their
 * historical shares are volatile.
 *
 * <p>{@code sentimentBalance} is always {@code "0"}; sentiment is not wired
 * into the forecasting core. Margin and swing magnitude carry 2-decimal
 * precision; volatility, trend shift and uncertainty carry 4.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SwingRegionRecord(
    @JsonProperty("runId")              Long            runId,
    @JsonProperty("region")             String          region,
    @JsonProperty("regionName")         String          regionName,
    @JsonProperty("position")           String          position,
    @JsonProperty("marginPercent")      double          marginPercent,
    @JsonProperty("marginVotes")        long            marginVotes,
    @JsonProperty("volatilityScore")    double          volatilityScore,
    @JsonProperty("swingMagnitude")     double          swingMagnitude,
    @JsonProperty("leadingEntity")      String          leadingEntity,
    @JsonProperty("challengingEntity")  String          challengingEntity,
    @JsonProperty("sentimentBalance")   String          sentimentBalance,
    @JsonProperty("recentTrendShift")   double          recentTrendShift,
    @JsonProperty("outcomeUncertainty") double          outcomeUncertainty,
    @JsonProperty("keyFactors")         List<KeyFactor> keyFactors
) {
    public static final String NEUTRAL_SENTIMENT = "0";

    public SwingRegionRecord withRunId(long id) {
        return new SwingRegionRecord(id, region, regionName, position, marginPercent,
            marginVotes, volatilityScore, swingMagnitude, leadingEntity, challengingEntity,
            sentimentBalance, recentTrendShift, outcomeUncertainty, keyFactors);
    }
}
