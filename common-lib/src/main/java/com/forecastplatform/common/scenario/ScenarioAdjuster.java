package com.forecastplatform.common.scenario;

import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.VoteShare;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Applies a {@link PredictionScenario}'s assumptions to computed party trends.
 *
 * <p>Only the latest share of each series is touched; slope, volatility and
 * growth rate stay as analysed. Order of application:
 * <ol>
 *   <li>poll blend: {@code last * (1 - w) + poll * w}</li>
 *   <li>manual adjustment: {@code + voteShareAdjust}</li>
 * </ol>
 * Inputs are never mutated; adjusted parties get new records.
 */
public final class ScenarioAdjuster {

    /** Multiplier floor so external factors can never remove all noise. */
    static final double MIN_VOLATILITY_MULTIPLIER = 0.1;

    /** Effect of one full unit of summed factor impact on the multiplier. */
    static final double FACTOR_SENSITIVITY = 0.1;

    private ScenarioAdjuster() {}

    public static Map<String, PartyTrendData> adjust(Map<String, PartyTrendData> trends,
                                                     PredictionScenario scenario) {
        Map<String, PartyTrendData> adjusted = new LinkedHashMap<>(trends);

        for (PollingData poll : scenario.pollingData()) {
            double weight = scenario.pollingWeight();
            adjusted.computeIfPresent(poll.party(), (party, trend) ->
                withLatestShare(trend, last -> last * (1 - weight) + poll.pollPercent() * weight));
        }

        scenario.partyAdjustments().forEach((party, adjustment) -> {
            if (adjustment.voteShareAdjust() == 0) return;
            adjusted.computeIfPresent(party, (p, trend) ->
                withLatestShare(trend, last -> last + adjustment.voteShareAdjust()));
        });

        return Collections.unmodifiableMap(adjusted);
    }

    /** {@code max(0.1, base + sum(±magnitude / 100) * 0.1)}. */
    public static double volatilityMultiplier(double base, List<ExternalFactor> factors) {
        if (factors == null || factors.isEmpty()) return base;
        double totalImpact = 0;
        for (ExternalFactor factor : factors) {
            double signed = factor.isPositive() ? factor.magnitude() : -factor.magnitude();
            totalImpact += signed / 100.0;
        }
        return Math.max(MIN_VOLATILITY_MULTIPLIER, base + totalImpact * FACTOR_SENSITIVITY);
    }

    private static PartyTrendData withLatestShare(PartyTrendData trend,
                                                  DoubleUnaryOperator change) {
        VoteShare last = trend.latest();
        if (last == null) return trend;
        List<VoteShare> series = new ArrayList<>(trend.historicalVotes());
        series.set(series.size() - 1, last.withShare(change.applyAsDouble(last.share())));
        return trend.withHistoricalVotes(series);
    }
}
