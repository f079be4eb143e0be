package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Effective model configuration of a forecast run.
 *
 * <p>{@code historicalWeightDecay} and {@code sentimentWeight} are carried
 * through to the persisted run but no formula reads them yet.
 * {@code trendWeight} is only attached as the descriptive weight of the
 * "Historical trend" influence factor; it is not a blending coefficient.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelParameters(
    @JsonProperty("monteCarloIterations")  int    monteCarloIterations,
    @JsonProperty("confidenceLevel")       double confidenceLevel,
    @JsonProperty("historicalWeightDecay") double historicalWeightDecay,
    @JsonProperty("sentimentWeight")       double sentimentWeight,
    @JsonProperty("trendWeight")           double trendWeight,
    @JsonProperty("volatilityMultiplier")  double volatilityMultiplier
) {
    public static final ModelParameters DEFAULTS = new ModelParameters(10_000, 0.95, 0.85, 0.15, 0.4, 1.2);

    public ModelParameters {
        if (monteCarloIterations < 1) {
            throw new IllegalArgumentException("monteCarloIterations must be >= 1, got " + monteCarloIterations);
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1), got " + confidenceLevel);
        }
    }

    /**
     * Overlays the non-null fields of {@code overrides} on top of this instance.
     *
     * @param overrides caller-supplied partial parameters; {@code null} returns {@code this}
     */
    public ModelParameters merge(ModelParameterOverrides overrides) {
        if (overrides == null) return this;
        return new ModelParameters(
            overrides.monteCarloIterations()  != null ? overrides.monteCarloIterations()  : monteCarloIterations,
            overrides.confidenceLevel()       != null ? overrides.confidenceLevel()       : confidenceLevel,
            overrides.historicalWeightDecay() != null ? overrides.historicalWeightDecay() : historicalWeightDecay,
            overrides.sentimentWeight()       != null ? overrides.sentimentWeight()       : sentimentWeight,
            overrides.trendWeight()           != null ? overrides.trendWeight()           : trendWeight,
            overrides.volatilityMultiplier()  != null ? overrides.volatilityMultiplier()  : volatilityMultiplier);
    }

    public ModelParameters withVolatilityMultiplier(double multiplier) {
        return new ModelParameters(monteCarloIterations, confidenceLevel, historicalWeightDecay,
            sentimentWeight, trendWeight, multiplier);
    }
}
