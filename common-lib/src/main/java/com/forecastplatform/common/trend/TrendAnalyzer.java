package com.forecastplatform.common.trend;

import com.forecastplatform.common.aggregate.AggregatedHistory;
import com.forecastplatform.common.aggregate.HistoricalDataAggregator;
import com.forecastplatform.common.model.HistoricalDataPoint;
import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.VoteShare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives per-party trend statistics from historical vote tallies.
 *
 * <h3>Statistics</h3>
 * <ul>
 *   <li><strong>Trend slope</strong>: ordinary least squares of share against
 *       year, in percentage points per year. Needs at least two points;
 *       a degenerate fit (all years equal) yields 0.</li>
 *   <li><strong>Volatility</strong>: sample standard deviation of the shares
 *       (divisor {@code n-1}); 0 below two points.</li>
 *   <li><strong>Average growth rate</strong>: mean of {@code (s[i] - s[i-1]) / s[i-1]}
 *       over consecutive entries, skipping periods whose prior share is 0.</li>
 * </ul>
 *
 * <p>Never throws on degenerate input: every statistic falls back to 0.
 */
public final class TrendAnalyzer {

    private static final int MIN_POINTS = 2;

    private TrendAnalyzer() {}

    /**
     * Aggregates {@code data} and computes trend statistics for every party.
     *
     * @return party → trend data, in first-seen party order; empty for empty input
     */
    public static Map<String, PartyTrendData> analyze(List<HistoricalDataPoint> data) {
        return analyze(HistoricalDataAggregator.aggregate(data));
    }

    public static Map<String, PartyTrendData> analyze(AggregatedHistory history) {
        Map<String, PartyTrendData> trends = new LinkedHashMap<>();
        history.byParty().forEach((party, series) -> trends.put(party, analyzeParty(party, series)));
        return Collections.unmodifiableMap(trends);
    }

    public static PartyTrendData analyzeParty(String party, List<VoteShare> series) {
        return new PartyTrendData(
            party,
            series,
            trendSlope(series),
            volatility(series),
            averageGrowthRate(series));
    }

    public static double trendSlope(List<VoteShare> series) {
        int n = series.size();
        if (n < MIN_POINTS) return 0.0;

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (VoteShare point : series) {
            double x = point.year();
            double y = point.share();
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumX2 += x * x;
        }

        double denominator = n * sumX2 - sumX * sumX;
        double slope = (n * sumXY - sumX * sumY) / denominator;
        return Double.isFinite(slope) ? slope : 0.0;
    }

    public static double volatility(List<VoteShare> series) {
        return standardDeviation(series.stream().mapToDouble(VoteShare::share).toArray());
    }

    /** Sample standard deviation; 0 for fewer than two values. */
    public static double standardDeviation(double[] values) {
        int n = values.length;
        if (n < MIN_POINTS) return 0.0;

        double sum = 0;
        for (double v : values) sum += v;
        double mean = sum / n;

        double squared = 0;
        for (double v : values) {
            double diff = v - mean;
            squared += diff * diff;
        }
        return Math.sqrt(squared / (n - 1));
    }

    public static double averageGrowthRate(List<VoteShare> series) {
        double total = 0;
        int periods = 0;
        for (int i = 1; i < series.size(); i++) {
            double previous = series.get(i - 1).share();
            if (previous == 0) continue;
            total += (series.get(i).share() - previous) / previous;
            periods++;
        }
        return periods > 0 ? total / periods : 0.0;
    }
}
