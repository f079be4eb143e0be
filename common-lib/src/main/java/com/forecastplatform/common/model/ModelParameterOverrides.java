package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial {@link ModelParameters} as supplied by a caller. Null fields keep the
 * configured default.
 */
public record ModelParameterOverrides(
    @JsonProperty("monteCarloIterations")  Integer monteCarloIterations,
    @JsonProperty("confidenceLevel")       Double  confidenceLevel,
    @JsonProperty("historicalWeightDecay") Double  historicalWeightDecay,
    @JsonProperty("sentimentWeight")       Double  sentimentWeight,
    @JsonProperty("trendWeight")           Double  trendWeight,
    @JsonProperty("volatilityMultiplier")  Double  volatilityMultiplier
) {
    public static ModelParameterOverrides none() {
        return new ModelParameterOverrides(null, null, null, null, null, null);
    }
}
