package com.forecastplatform.orchestrator.service;

import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.ForecastSummary;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.model.RunSummary;
import com.forecastplatform.common.port.ForecastStore;
import com.forecastplatform.common.scenario.PredictionScenario;
import com.forecastplatform.orchestrator.dto.CreateForecastRequest;
import com.forecastplatform.orchestrator.dto.ScenarioForecastRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.function.LongFunction;

/**
 * Creates runs and executes them in the background.
 *
 * <p>The caller gets the pending run as soon as the store has assigned its id;
 * orchestration is subscribed separately and its outcome is only observable by
 * polling {@link #getSummary(long)}. Background failures are logged, never
 * rethrown to the caller.
 */
@Service
public class ForecastRunLauncher {

    private static final Logger log = LoggerFactory.getLogger(ForecastRunLauncher.class);

    /** Party results included in a run summary. */
    static final int SUMMARY_TOP_PARTIES = 10;

    private final ForecastStore forecastStore;
    private final ForecastOrchestrator orchestrator;
    private final ModelParameters defaultParameters;
    private final Clock clock;

    public ForecastRunLauncher(ForecastStore forecastStore,
                               ForecastOrchestrator orchestrator,
                               ModelParameters defaultModelParameters,
                               Clock clock) {
        this.forecastStore     = forecastStore;
        this.orchestrator      = orchestrator;
        this.defaultParameters = defaultModelParameters;
        this.clock             = clock;
    }

    public Mono<ForecastRun> createAndRun(String createdBy, CreateForecastRequest request) {
        return Mono.fromCallable(() -> ForecastRun.pending(
                request.displayName(), request.description(), request.targetYear(),
                request.targetPosition(), request.targetState(), request.targetElectionType(),
                request.historicalYears(), defaultParameters.merge(request.modelParameters()),
                createdBy, Instant.now(clock)))
            .flatMap(forecastStore::createForecastRun)
            .doOnNext(run -> launch(run, id -> orchestrator.runForecast(id, request.toOptions())));
    }

    public Mono<ForecastRun> createAndRunScenario(String createdBy, ScenarioForecastRequest request) {
        PredictionScenario scenario = request.scenario();
        if (scenario == null) {
            return Mono.error(new IllegalArgumentException("scenario is required"));
        }
        return Mono.fromCallable(() -> ForecastRun.pending(
                scenario.name(), request.description(), scenario.targetYear(),
                scenario.position(), scenario.state(), null, null,
                scenario.baseParameters(), createdBy, Instant.now(clock)))
            .flatMap(forecastStore::createForecastRun)
            .doOnNext(run -> launch(run, id -> orchestrator.runScenario(id, scenario)));
    }

    /** @return run, top party results and swing regions; empty when the run is unknown */
    public Mono<RunSummary> getSummary(long runId) {
        return forecastStore.getForecastRun(runId)
            .flatMap(run -> Mono.zip(forecastStore.getForecastResults(runId), forecastStore.getSwingRegions(runId))
                .map(t -> new RunSummary(
                    run,
                    t.getT1().stream().limit(SUMMARY_TOP_PARTIES).toList(),
                    t.getT2())));
    }

    private void launch(ForecastRun run, LongFunction<Mono<ForecastSummary>> work) {
        long runId = run.id();
        Mono.defer(() -> work.apply(runId))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                summary -> log.info("Forecast run finished. runId={} parties={} swingRegions={}",
                                    runId, summary.partyResults().size(), summary.swingRegions().size()),
                err -> log.error("Forecast run failed. runId={} errorType={} reason={}",
                                 runId, err.getClass().getSimpleName(), err.getMessage())
            );
    }
}
