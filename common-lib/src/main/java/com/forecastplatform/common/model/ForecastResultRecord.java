package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-party forecast row handed to the external store.
 *
 * <p>{@code runId} is {@code null} while the record is being computed and is
 * stamped by the orchestrator via {@link #withRunId(long)} just before
 * persistence. {@code region} is only set by scenario forecasts scoped to a state.
 * Share, bound, strength and confidence values carry 4-decimal precision.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastResultRecord(
    @JsonProperty("runId")              Long                  runId,
    @JsonProperty("resultType")         String                resultType,
    @JsonProperty("entityName")         String                entityName,
    @JsonProperty("region")             String                region,
    @JsonProperty("predictedVoteShare") double                predictedVoteShare,
    @JsonProperty("voteShareLower")     double                voteShareLower,
    @JsonProperty("voteShareUpper")     double                voteShareUpper,
    @JsonProperty("historicalTrend")    HistoricalTrend       historicalTrend,
    @JsonProperty("trendDirection")     TrendDirection        trendDirection,
    @JsonProperty("trendStrength")      double                trendStrength,
    @JsonProperty("confidence")         double                confidence,
    @JsonProperty("influenceFactors")   List<InfluenceFactor> influenceFactors
) {
    public ForecastResultRecord withRunId(long id) {
        return new ForecastResultRecord(id, resultType, entityName, region,
            predictedVoteShare, voteShareLower, voteShareUpper, historicalTrend,
            trendDirection, trendStrength, confidence, influenceFactors);
    }
}
