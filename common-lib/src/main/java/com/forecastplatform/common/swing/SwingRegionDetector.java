package com.forecastplatform.common.swing;

import com.forecastplatform.common.aggregate.HistoricalDataAggregator;
import com.forecastplatform.common.model.HistoricalDataPoint;
import com.forecastplatform.common.model.KeyFactor;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.Precision;
import com.forecastplatform.common.model.SwingRegionRecord;
import com.forecastplatform.common.region.RegionNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Flags regions whose latest race was both close and historically volatile.
 *
 * <p>For every region: take the most recent year's rows, rank them by votes,
 * and compare the two leading parties. The region is a swing region when the
 * margin between them is under {@link SwingThresholds#maxSwingMargin()} and
 * the mean of their (national) share volatilities exceeds
 * {@link SwingThresholds#minSwingVolatility()}. Both comparisons are strict.
 *
 * <p>Pure function. Output is sorted by volatility score descending.
 */
public final class SwingRegionDetector {

    public static final String FACTOR_TIGHT_MARGIN        = "Tight margin";
    public static final String FACTOR_HIGH_VOLATILITY     = "High historical volatility";
    public static final String FACTOR_CHALLENGER_RISING   = "Challenger ascending";

    private SwingRegionDetector() {}

    public static List<SwingRegionRecord> detect(List<HistoricalDataPoint> data,
                                                 Map<String, PartyTrendData> trends,
                                                 ModelParameters params) {
        return detect(data, trends, params, SwingThresholds.DEFAULTS);
    }

    public static List<SwingRegionRecord> detect(List<HistoricalDataPoint> data,
                                                 Map<String, PartyTrendData> trends,
                                                 ModelParameters params,
                                                 SwingThresholds thresholds) {
        List<SwingRegionRecord> regions = new ArrayList<>();
        HistoricalDataAggregator.groupByRegion(data).forEach((region, rows) -> {
            SwingRegionRecord record = evaluateRegion(region, rows, trends, params, thresholds);
            if (record != null) regions.add(record);
        });
        regions.sort(Comparator.comparingDouble(SwingRegionRecord::volatilityScore).reversed());
        return regions;
    }

    /** @return the swing record for this region, or {@code null} when it is not contested */
    static SwingRegionRecord evaluateRegion(String region,
                                            List<HistoricalDataPoint> rows,
                                            Map<String, PartyTrendData> trends,
                                            ModelParameters params,
                                            SwingThresholds thresholds) {
        int latestYear = rows.stream().mapToInt(HistoricalDataPoint::year).max().orElseThrow();
        List<HistoricalDataPoint> latest = rows.stream()
            .filter(r -> r.year() == latestYear)
            .sorted(Comparator.comparingLong(HistoricalDataPoint::totalVotes).reversed())
            .toList();
        if (latest.size() < 2) return null;

        HistoricalDataPoint leader = latest.get(0);
        HistoricalDataPoint challenger = latest.get(1);
        long regionTotal = latest.stream().mapToLong(HistoricalDataPoint::totalVotes).sum();
        long marginVotes = leader.totalVotes() - challenger.totalVotes();
        double margin = HistoricalDataAggregator.shareOf(marginVotes, regionTotal);

        PartyTrendData leaderTrend = trends.get(leader.party());
        PartyTrendData challengerTrend = trends.get(challenger.party());
        double avgVolatility = (volatilityOf(leaderTrend) + volatilityOf(challengerTrend)) / 2.0;

        if (!isSwing(margin, avgVolatility, thresholds)) return null;

        double trendShift = slopeOf(challengerTrend) - slopeOf(leaderTrend);

        return new SwingRegionRecord(
            null,
            region,
            RegionNames.nameOf(region),
            leader.position(),
            Precision.coarse(margin),
            marginVotes,
            Precision.fine(avgVolatility),
            Precision.coarse(avgVolatility * params.volatilityMultiplier()),
            leader.party(),
            challenger.party(),
            SwingRegionRecord.NEUTRAL_SENTIMENT,
            Precision.fine(trendShift),
            Precision.fine(outcomeUncertainty(margin, avgVolatility, thresholds)),
            keyFactors(margin, avgVolatility, trendShift, thresholds));
    }

    public static boolean isSwing(double margin, double avgVolatility, SwingThresholds thresholds) {
        return margin < thresholds.maxSwingMargin() && avgVolatility > thresholds.minSwingVolatility();
    }

    /** {@code min(1, (maxMargin - margin) / maxMargin * avgVolatility / scale)}. */
    public static double outcomeUncertainty(double margin, double avgVolatility, SwingThresholds thresholds) {
        double closeness = (thresholds.maxSwingMargin() - margin) / thresholds.maxSwingMargin();
        return Math.min(1.0, closeness * avgVolatility / thresholds.uncertaintyVolatility());
    }

    static List<KeyFactor> keyFactors(double margin, double avgVolatility, double trendShift,
                                      SwingThresholds thresholds) {
        List<KeyFactor> factors = new ArrayList<>(3);
        factors.add(new KeyFactor(FACTOR_TIGHT_MARGIN, margin < thresholds.tightMargin() ? "high" : "medium"));
        factors.add(new KeyFactor(FACTOR_HIGH_VOLATILITY,
            avgVolatility > thresholds.highVolatility() ? "high" : "medium"));
        if (trendShift > 0) {
            factors.add(new KeyFactor(FACTOR_CHALLENGER_RISING, "high"));
        }
        return List.copyOf(factors);
    }

    private static double volatilityOf(PartyTrendData trend) {
        return trend != null ? trend.volatility() : 0.0;
    }

    private static double slopeOf(PartyTrendData trend) {
        return trend != null ? trend.trendSlope() : 0.0;
    }
}
