package com.forecastplatform.common.forecast;

import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.HistoricalTrend;
import com.forecastplatform.common.model.InfluenceFactor;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.model.MonteCarloResult;
import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.Precision;
import com.forecastplatform.common.model.TrendDirection;
import com.forecastplatform.common.model.VoteShare;
import com.forecastplatform.common.simulation.MonteCarloSimulator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Projects each party's vote share to a target year and wraps the Monte Carlo
 * distribution into a {@link ForecastResultRecord}.
 *
 * <h3>Per-party projection</h3>
 * <ol>
 *   <li>Start from the latest share of the series and extrapolate linearly:
 *       {@code projection = lastShare + slope * yearsDelta}.</li>
 *   <li>Widen the noise with the horizon:
 *       {@code volatility * volatilityMultiplier * sqrt(yearsDelta)}, 0 when the
 *       target year is not after the last observed year.</li>
 *   <li>Simulate around the projection with no further trend adjustment.</li>
 *   <li>Classify direction and confidence, attach influence factors.</li>
 * </ol>
 *
 * <p>Each party draws from its own stream split off the run-level generator,
 * so one party's result does not depend on how many draws another consumed.
 */
public final class ForecastGenerator {

    public static final String RESULT_TYPE_PARTY = "party";

    /** Slope (points/year) above which a trend is rising, below whose negation it is falling. */
    static final double DIRECTION_THRESHOLD = 0.5;

    static final double MIN_CONFIDENCE = 0.3;
    static final double DISPERSION_PENALTY = 0.5;

    /** Volatility above which the "Volatility" factor is rated high. */
    static final double HIGH_VOLATILITY = 5.0;
    static final double SECONDARY_FACTOR_WEIGHT = 0.2;

    public static final String FACTOR_HISTORICAL_TREND = "Historical trend";
    public static final String FACTOR_VOLATILITY       = "Volatility";
    public static final String FACTOR_GROWTH_RATE      = "Growth rate";

    private ForecastGenerator() {}

    public static List<ForecastResultRecord> generate(Map<String, PartyTrendData> trends,
                                                      int targetYear,
                                                      ModelParameters params) {
        return generate(trends, targetYear, params, new SplittableRandom());
    }

    /**
     * @param trends     party → trend data, as produced by the trend analyzer
     * @param targetYear election year to project to
     * @param params     effective model parameters
     * @param random     run-level generator; one child stream is split per party
     * @return one record per party with at least one data point, sorted by
     *         predicted share descending; {@code runId} is unset
     */
    public static List<ForecastResultRecord> generate(Map<String, PartyTrendData> trends,
                                                      int targetYear,
                                                      ModelParameters params,
                                                      SplittableRandom random) {
        List<ForecastResultRecord> results = new ArrayList<>();
        for (PartyTrendData trend : trends.values()) {
            VoteShare last = trend.latest();
            if (last == null) continue;
            results.add(forecastParty(trend, last, targetYear, params, random.split()));
        }
        results.sort(Comparator.comparingDouble(ForecastResultRecord::predictedVoteShare).reversed());
        return results;
    }

    static ForecastResultRecord forecastParty(PartyTrendData trend, VoteShare last, int targetYear,
                                              ModelParameters params, RandomGenerator stream) {
        int yearsDelta = targetYear - last.year();
        double projection = last.share() + trend.trendSlope() * yearsDelta;
        double volatility = adjustedVolatility(trend.volatility(), params.volatilityMultiplier(), yearsDelta);

        MonteCarloResult simulation = MonteCarloSimulator.simulate(
            projection, volatility, 0.0,
            params.monteCarloIterations(), params.confidenceLevel(), stream);

        TrendDirection direction = classifyDirection(trend.trendSlope());

        return new ForecastResultRecord(
            null,
            RESULT_TYPE_PARTY,
            trend.party(),
            null,
            Precision.fine(simulation.mean()),
            Precision.fine(simulation.lower()),
            Precision.fine(simulation.upper()),
            HistoricalTrend.of(trend.historicalVotes()),
            direction,
            Precision.fine(Math.abs(trend.trendSlope())),
            Precision.fine(confidence(simulation.mean(), simulation.standardDeviation())),
            influenceFactors(trend, direction, params.trendWeight()));
    }

    public static double adjustedVolatility(double volatility, double multiplier, int yearsDelta) {
        if (yearsDelta <= 0) return 0.0;
        return volatility * multiplier * Math.sqrt(yearsDelta);
    }

    public static TrendDirection classifyDirection(double slope) {
        if (slope > DIRECTION_THRESHOLD) return TrendDirection.RISING;
        if (slope < -DIRECTION_THRESHOLD) return TrendDirection.FALLING;
        return TrendDirection.STABLE;
    }

    /**
     * {@code max(0.3, 1 - sd / mean * 0.5)}, capped at 1. A zero mean has no
     * meaningful dispersion ratio and gets the floor.
     */
    public static double confidence(double mean, double standardDeviation) {
        if (mean <= 0) return MIN_CONFIDENCE;
        double raw = 1.0 - (standardDeviation / mean) * DISPERSION_PENALTY;
        return Math.min(1.0, Math.max(MIN_CONFIDENCE, raw));
    }

    public static List<InfluenceFactor> influenceFactors(PartyTrendData trend, TrendDirection direction,
                                                         double trendWeight) {
        return List.of(
            new InfluenceFactor(FACTOR_HISTORICAL_TREND, trendWeight, direction.label()),
            new InfluenceFactor(FACTOR_VOLATILITY, SECONDARY_FACTOR_WEIGHT,
                trend.volatility() > HIGH_VOLATILITY ? "high" : "medium"),
            new InfluenceFactor(FACTOR_GROWTH_RATE, SECONDARY_FACTOR_WEIGHT,
                trend.avgGrowthRate() > 0 ? "positive" : "negative"));
    }
}
