package com.forecastplatform.common.port;

import com.forecastplatform.common.model.HistoricalDataPoint;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read access to historical per-party vote tallies.
 *
 * <p>Current implementation: {@code HistoricalDataClient}, which queries the
 * history service over HTTP.
 */
public interface HistoricalDataSource {

    /**
     * Vote totals per party for the given years, optionally narrowed to one
     * contested position and/or one state.
     *
     * @param years    election years to include
     * @param position position filter, {@code null} for all
     * @param state    state code filter, {@code null} for all
     * @return the matching rows; an empty list (not an error) when nothing matches
     */
    Mono<List<HistoricalDataPoint>> getHistoricalVotesByParty(List<Integer> years, String position, String state);
}
