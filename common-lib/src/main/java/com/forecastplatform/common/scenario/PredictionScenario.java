package com.forecastplatform.common.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forecastplatform.common.model.ModelParameters;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A what-if forecast: historical data up to {@code baseYear} reshaped by polls,
 * manual per-party adjustments and external factors, then projected to
 * {@code targetYear}.
 *
 * <p>Absent numeric settings take their defaults in the compact constructor;
 * absent collections become empty.
 */
public record PredictionScenario(
    @JsonProperty("id")                   Long                         id,
    @JsonProperty("name")                 String                       name,
    @JsonProperty("baseYear")             int                          baseYear,
    @JsonProperty("targetYear")           int                          targetYear,
    @JsonProperty("state")                String                       state,
    @JsonProperty("position")             String                       position,
    @JsonProperty("pollingData")          List<PollingData>            pollingData,
    @JsonProperty("pollingWeight")        Double                       pollingWeight,
    @JsonProperty("partyAdjustments")     Map<String, PartyAdjustment> partyAdjustments,
    @JsonProperty("externalFactors")      List<ExternalFactor>         externalFactors,
    @JsonProperty("monteCarloIterations") Integer                      monteCarloIterations,
    @JsonProperty("confidenceLevel")      Double                       confidenceLevel,
    @JsonProperty("volatilityMultiplier") Double                       volatilityMultiplier,
    @JsonProperty("historicalWeight")     Double                       historicalWeight,
    @JsonProperty("adjustmentWeight")     Double                       adjustmentWeight
) {
    public static final double DEFAULT_POLLING_WEIGHT         = 0.30;
    public static final double DEFAULT_VOLATILITY_MULTIPLIER  = 1.20;
    public static final double DEFAULT_HISTORICAL_WEIGHT      = 0.50;
    public static final double DEFAULT_ADJUSTMENT_WEIGHT      = 0.20;

    public PredictionScenario {
        pollingData          = pollingData == null ? List.of() : List.copyOf(pollingData);
        partyAdjustments     = partyAdjustments == null ? Map.of() : withoutNullValues(partyAdjustments);
        externalFactors      = externalFactors == null ? List.of() : List.copyOf(externalFactors);
        pollingWeight        = pollingWeight == null ? DEFAULT_POLLING_WEIGHT : pollingWeight;
        monteCarloIterations = monteCarloIterations == null
            ? ModelParameters.DEFAULTS.monteCarloIterations() : monteCarloIterations;
        confidenceLevel      = confidenceLevel == null
            ? ModelParameters.DEFAULTS.confidenceLevel() : confidenceLevel;
        volatilityMultiplier = volatilityMultiplier == null ? DEFAULT_VOLATILITY_MULTIPLIER : volatilityMultiplier;
        historicalWeight     = historicalWeight == null ? DEFAULT_HISTORICAL_WEIGHT : historicalWeight;
        adjustmentWeight     = adjustmentWeight == null ? DEFAULT_ADJUSTMENT_WEIGHT : adjustmentWeight;
    }

    public boolean isNational() {
        return state == null || state.isBlank();
    }

    /**
     * Model parameters before external factors are applied. The historical and
     * adjustment weights fill the trend and sentiment slots.
     */
    public ModelParameters baseParameters() {
        return new ModelParameters(
            monteCarloIterations,
            confidenceLevel,
            ModelParameters.DEFAULTS.historicalWeightDecay(),
            adjustmentWeight,
            historicalWeight,
            volatilityMultiplier);
    }

    /** A JSON {@code null} adjustment means "no adjustment" for that party. */
    private static Map<String, PartyAdjustment> withoutNullValues(Map<String, PartyAdjustment> adjustments) {
        return adjustments.entrySet().stream()
            .filter(e -> e.getKey() != null && e.getValue() != null)
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
