package com.forecastplatform.common.port;

import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.ForecastRunUpdate;
import com.forecastplatform.common.model.SwingRegionRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Persistence of forecast runs and their outputs. The forecasting core never
 * stores anything itself.
 *
 * <p>Implementations MUST be non-blocking. Errors propagate to the caller.
 */
public interface ForecastStore {

    /** Persists a new run and returns it with its assigned id. */
    Mono<ForecastRun> createForecastRun(ForecastRun run);

    /** @return the run, or an empty {@code Mono} when no run has this id */
    Mono<ForecastRun> getForecastRun(long runId);

    /** Applies the non-null fields of {@code update} and returns the updated run. */
    Mono<ForecastRun> updateForecastRun(long runId, ForecastRunUpdate update);

    Mono<List<ForecastResultRecord>> createForecastResults(List<ForecastResultRecord> results);

    Mono<List<SwingRegionRecord>> createSwingRegions(List<SwingRegionRecord> regions);

    /** Party results of a run, as persisted (ordered by predicted share descending). */
    Mono<List<ForecastResultRecord>> getForecastResults(long runId);

    Mono<List<SwingRegionRecord>> getSwingRegions(long runId);
}
