package com.forecastplatform.common.aggregate;

import com.forecastplatform.common.model.VoteShare;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link HistoricalDataAggregator#aggregate}.
 *
 * @param byParty    party → share series ordered by year ascending, in first-seen party order
 * @param yearTotals year → total votes across all parties (and regions) that year
 */
public record AggregatedHistory(
    Map<String, List<VoteShare>> byParty,
    Map<Integer, Long>           yearTotals
) {
    public static AggregatedHistory empty() {
        return new AggregatedHistory(Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return byParty.isEmpty();
    }
}
