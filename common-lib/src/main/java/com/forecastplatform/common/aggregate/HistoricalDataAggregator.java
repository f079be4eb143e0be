package com.forecastplatform.common.aggregate;

import com.forecastplatform.common.model.HistoricalDataPoint;
import com.forecastplatform.common.model.VoteShare;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw historical vote tallies into per-party vote-share series.
 *
 * <p>Each input row becomes exactly one {@link VoteShare} entry of its party's
 * series; rows for the same party and year (e.g. one per region) are not
 * merged. The share denominator is the total of all rows in that year.
 *
 * <p>No Spring dependencies. No I/O. The input list is never mutated and the
 * returned maps are unmodifiable.
 */
public final class HistoricalDataAggregator {

    private HistoricalDataAggregator() {}

    public static AggregatedHistory aggregate(List<HistoricalDataPoint> data) {
        if (data == null || data.isEmpty()) {
            return AggregatedHistory.empty();
        }

        Map<Integer, Long> yearTotals = new LinkedHashMap<>();
        for (HistoricalDataPoint point : data) {
            yearTotals.merge(point.year(), point.totalVotes(), Long::sum);
        }

        Map<String, List<VoteShare>> series = new LinkedHashMap<>();
        for (HistoricalDataPoint point : data) {
            long yearTotal = yearTotals.getOrDefault(point.year(), 0L);
            double share = shareOf(point.totalVotes(), yearTotal);
            series.computeIfAbsent(point.party(), p -> new ArrayList<>())
                  .add(new VoteShare(point.year(), point.totalVotes(), share));
        }

        Map<String, List<VoteShare>> byParty = new LinkedHashMap<>();
        series.forEach((party, votes) -> {
            // List.sort is stable: equal years keep input order
            votes.sort(Comparator.comparingInt(VoteShare::year));
            byParty.put(party, List.copyOf(votes));
        });

        return new AggregatedHistory(
            Collections.unmodifiableMap(byParty),
            Collections.unmodifiableMap(yearTotals));
    }

    /**
     * Groups rows by region code in first-seen order. Rows with a null or blank
     * region are skipped.
     */
    public static Map<String, List<HistoricalDataPoint>> groupByRegion(List<HistoricalDataPoint> data) {
        Map<String, List<HistoricalDataPoint>> byRegion = new LinkedHashMap<>();
        if (data == null) return byRegion;
        for (HistoricalDataPoint point : data) {
            if (point.region() == null || point.region().isBlank()) continue;
            byRegion.computeIfAbsent(point.region(), r -> new ArrayList<>()).add(point);
        }
        return byRegion;
    }

    /** {@code votes / total * 100}, or 0 when the total is 0. */
    public static double shareOf(long votes, long total) {
        return total != 0 ? (double) votes / total * 100.0 : 0.0;
    }
}
