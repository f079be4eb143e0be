package com.forecastplatform.common.scenario;

import com.forecastplatform.common.forecast.ForecastGenerator;
import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.HistoricalTrend;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.model.MonteCarloResult;
import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.Precision;
import com.forecastplatform.common.model.TrendDirection;
import com.forecastplatform.common.model.VoteShare;
import com.forecastplatform.common.simulation.MonteCarloSimulator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Forecasts a scenario from (already adjusted) party trends.
 *
 * <p>Unlike {@link ForecastGenerator} the simulation is centred on the latest
 * share with the trend slope as a one-step adjustment, and the resulting means
 * are normalised so the field adds up to 100%. Bounds are scaled by the same
 * factor.
 */
public final class ScenarioForecastGenerator {

    /** Centre used for a party with an empty series. */
    static final double DEFAULT_BASE_SHARE = 5.0;

    private ScenarioForecastGenerator() {}

    /**
     * @param trends adjusted party trends
     * @param params effective parameters, volatility multiplier already including external factors
     * @param region state code the scenario is scoped to, or {@code null} for national
     * @param random run-level generator; one child stream per party
     * @return one record per party, sorted by predicted share descending
     */
    public static List<ForecastResultRecord> generate(Map<String, PartyTrendData> trends,
                                                      ModelParameters params,
                                                      String region,
                                                      SplittableRandom random) {
        Map<PartyTrendData, MonteCarloResult> simulations = new LinkedHashMap<>();
        for (PartyTrendData trend : trends.values()) {
            VoteShare last = trend.latest();
            double base = last != null ? last.share() : DEFAULT_BASE_SHARE;
            simulations.put(trend, MonteCarloSimulator.simulate(
                base,
                trend.volatility() * params.volatilityMultiplier(),
                trend.trendSlope(),
                params.monteCarloIterations(),
                params.confidenceLevel(),
                random.split()));
        }

        double totalMean = simulations.values().stream().mapToDouble(MonteCarloResult::mean).sum();
        double factor = normalizationFactor(totalMean);

        List<ForecastResultRecord> results = new ArrayList<>();
        simulations.forEach((trend, sim) -> {
            TrendDirection direction = ForecastGenerator.classifyDirection(trend.trendSlope());
            results.add(new ForecastResultRecord(
                null,
                ForecastGenerator.RESULT_TYPE_PARTY,
                trend.party(),
                region,
                Precision.fine(sim.mean() * factor),
                Precision.fine(sim.lower() * factor),
                Precision.fine(sim.upper() * factor),
                HistoricalTrend.of(trend.historicalVotes()),
                direction,
                Precision.fine(Math.abs(trend.trendSlope())),
                Precision.fine(ForecastGenerator.confidence(sim.mean(), sim.standardDeviation())),
                ForecastGenerator.influenceFactors(trend, direction, params.trendWeight())));
        });
        results.sort(Comparator.comparingDouble(ForecastResultRecord::predictedVoteShare).reversed());
        return results;
    }

    /** {@code 100 / total}, or 1 when the total is not positive. */
    public static double normalizationFactor(double totalMean) {
        return totalMean > 0 ? 100.0 / totalMean : 1.0;
    }
}
