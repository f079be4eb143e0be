package com.forecastplatform.orchestrator.logger;

import com.forecastplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the forecast run lifecycle.
 *
 * <p>Logs each stage of a run without touching pipeline behaviour. All methods
 * are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #RUN_STARTED}        run marked running</li>
 *   <li>{@link #HISTORY_FETCHED}    historical tallies received and non-empty</li>
 *   <li>{@link #MODEL_COMPUTED}     trends, party forecasts and swing regions computed</li>
 *   <li>{@link #NARRATIVE_READY}    narrative generated or fallback chosen</li>
 *   <li>{@link #RESULTS_PERSISTED}  results and swing regions handed to the store</li>
 *   <li>{@link #RUN_COMPLETED}      run marked completed</li>
 * </ol>
 * {@link #RUN_FAILED} replaces the remaining stages when a run aborts.
 *
 * <p>Usage with {@code doOnEach} (reads the run id from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(ForecastFlowLogger.HISTORY_FETCHED))
 * </pre>
 */
@Component
public class ForecastFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ForecastFlowLogger.class);

    public static final String RUN_STARTED       = "RUN_STARTED";
    public static final String HISTORY_FETCHED   = "HISTORY_FETCHED";
    public static final String MODEL_COMPUTED    = "MODEL_COMPUTED";
    public static final String NARRATIVE_READY   = "NARRATIVE_READY";
    public static final String RESULTS_PERSISTED = "RESULTS_PERSISTED";
    public static final String RUN_COMPLETED     = "RUN_COMPLETED";
    public static final String RUN_FAILED        = "RUN_FAILED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext}
     * only. Bridges Context → MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            TraceContextUtil.withMdc(runId, () ->
                log.info("[ForecastFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    public void logFailure(long runId, Throwable error) {
        String id = String.valueOf(runId);
        TraceContextUtil.withMdc(id, () ->
            log.error("[ForecastFlow] stage={} runId={} errorType={} reason={}",
                RUN_FAILED, id, error.getClass().getSimpleName(), error.getMessage())
        );
    }

    /** One-line outcome of a completed run. */
    public void logOutcome(long runId, int parties, int swingRegions, String leader) {
        String id = String.valueOf(runId);
        TraceContextUtil.withMdc(id, () ->
            log.info("[ForecastFlow] stage={} runId={} parties={} swingRegions={} leader={}",
                RUN_COMPLETED, id, parties, swingRegions, leader)
        );
    }
}
