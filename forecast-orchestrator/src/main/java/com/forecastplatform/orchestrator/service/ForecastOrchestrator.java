package com.forecastplatform.orchestrator.service;

import com.forecastplatform.common.exception.DataInsufficiencyException;
import com.forecastplatform.common.exception.ForecastRunNotFoundException;
import com.forecastplatform.common.forecast.ForecastGenerator;
import com.forecastplatform.common.model.ForecastOptions;
import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.ForecastRunUpdate;
import com.forecastplatform.common.model.ForecastSummary;
import com.forecastplatform.common.model.HistoricalDataPoint;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.SwingRegionRecord;
import com.forecastplatform.common.port.ForecastStore;
import com.forecastplatform.common.port.HistoricalDataSource;
import com.forecastplatform.common.port.NarrativeGenerator;
import com.forecastplatform.common.scenario.PredictionScenario;
import com.forecastplatform.common.scenario.ScenarioAdjuster;
import com.forecastplatform.common.scenario.ScenarioForecastGenerator;
import com.forecastplatform.common.swing.SwingRegionDetector;
import com.forecastplatform.common.swing.SwingThresholds;
import com.forecastplatform.common.trace.TraceContextUtil;
import com.forecastplatform.common.trend.TrendAnalyzer;
import com.forecastplatform.orchestrator.logger.ForecastFlowLogger;
import com.forecastplatform.orchestrator.narrative.NarrativePromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;

/**
 * Drives one forecast run through {@code pending → running → completed | failed}.
 *
 * <p>Pipeline of a run:
 * <ol>
 *   <li>mark the run running</li>
 *   <li>fetch historical tallies; none → run failed, {@link DataInsufficiencyException}</li>
 *   <li>trends, party forecasts and swing regions (CPU-bound, on {@code boundedElastic})</li>
 *   <li>narrative; any failure or blank answer → fallback sentence</li>
 *   <li>persist results, then swing regions, then mark the run completed</li>
 * </ol>
 * Any other failure after step 1 marks the run failed (best effort) and is
 * propagated unchanged.
 *
 * <p>The run id travels in the Reactor Context and is bridged to MDC only
 * inside log calls.
 */
@Service
public class ForecastOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ForecastOrchestrator.class);

    /** Earliest election year with usable historical data. */
    static final int MIN_HISTORICAL_YEAR = 2002;
    static final int ELECTION_CYCLE_YEARS = 4;
    static final int LOOKBACK_CYCLES = 3;

    private final HistoricalDataSource historicalDataSource;
    private final ForecastStore forecastStore;
    private final NarrativeGenerator narrativeGenerator;
    private final ForecastFlowLogger flowLogger;
    private final ModelParameters defaultParameters;
    private final SwingThresholds swingThresholds;
    private final Clock clock;
    private final String narrativeLanguage;
    private final Long randomSeed;

    public ForecastOrchestrator(
            HistoricalDataSource historicalDataSource,
            ForecastStore forecastStore,
            NarrativeGenerator narrativeGenerator,
            ForecastFlowLogger flowLogger,
            ModelParameters defaultModelParameters,
            SwingThresholds swingThresholds,
            Clock clock,
            @Value("${narrative.language:Brazilian Portuguese}") String narrativeLanguage,
            @Value("${forecast.model.random-seed:#{null}}") Long randomSeed) {
        this.historicalDataSource = historicalDataSource;
        this.forecastStore        = forecastStore;
        this.narrativeGenerator   = narrativeGenerator;
        this.flowLogger           = flowLogger;
        this.defaultParameters    = defaultModelParameters;
        this.swingThresholds      = swingThresholds;
        this.clock                = clock;
        this.narrativeLanguage    = narrativeLanguage;
        this.randomSeed           = randomSeed;
    }

    /**
     * Executes a standard forecast for an existing run.
     *
     * @param runId   id of a run already created in the store
     * @param options target year and optional scope, years and parameter overrides
     * @return the persisted results, swing regions and narrative
     */
    public Mono<ForecastSummary> runForecast(long runId, ForecastOptions options) {
        Mono<ForecastSummary> pipeline = Mono.defer(() -> {
            ModelParameters params = defaultParameters.merge(options.modelParameters());
            List<Integer> years = resolveYears(options);
            log.info("Forecast run started. runId={} targetYear={} position={} state={} years={}",
                runId, options.targetYear(), options.targetPosition(), options.targetState(), years);

            return markRunning(runId)
                .then(fetchHistory(runId, years, options.targetPosition(), options.targetState()))
                .flatMap(data -> compute(() -> {
                    Map<String, PartyTrendData> trends = TrendAnalyzer.analyze(data);
                    return new Computation(
                        ForecastGenerator.generate(trends, options.targetYear(), params, newRandom(runId)),
                        SwingRegionDetector.detect(data, trends, params, swingThresholds));
                }))
                .doOnEach(flowLogger.stage(ForecastFlowLogger.MODEL_COMPUTED))
                .flatMap(computed -> loadRun(runId)
                    .flatMap(run -> narrative(
                        NarrativePromptBuilder.forRun(run, computed.results(), computed.swingRegions(), narrativeLanguage),
                        NarrativePromptBuilder.FALLBACK_NARRATIVE, runId))
                    .flatMap(narrative -> persistAndComplete(runId, computed, narrative, params, years)));
        });

        return TraceContextUtil.withRunId(pipeline.onErrorResume(e -> markFailed(runId, e)), runId);
    }

    /**
     * Executes a scenario forecast for an existing run: polls, manual
     * adjustments and external factors reshape the trends before simulation.
     */
    public Mono<ForecastSummary> runScenario(long runId, PredictionScenario scenario) {
        Mono<ForecastSummary> pipeline = Mono.defer(() -> {
            ModelParameters base = scenario.baseParameters();
            ModelParameters params = base.withVolatilityMultiplier(
                ScenarioAdjuster.volatilityMultiplier(base.volatilityMultiplier(), scenario.externalFactors()));
            List<Integer> years = scenarioYears(scenario.baseYear());
            log.info("Scenario run started. runId={} scenario={} baseYear={} targetYear={} state={} volatilityMultiplier={}",
                runId, scenario.name(), scenario.baseYear(), scenario.targetYear(), scenario.state(),
                params.volatilityMultiplier());

            return markRunning(runId)
                .then(fetchHistory(runId, years, scenario.position(), scenario.state()))
                .flatMap(data -> compute(() -> {
                    Map<String, PartyTrendData> trends = ScenarioAdjuster.adjust(TrendAnalyzer.analyze(data), scenario);
                    List<ForecastResultRecord> results = ScenarioForecastGenerator.generate(
                        trends, params, scenario.isNational() ? null : scenario.state(), newRandom(runId));
                    List<SwingRegionRecord> swings = scenario.isNational()
                        ? SwingRegionDetector.detect(data, trends, params, swingThresholds)
                        : List.of();
                    return new Computation(results, swings);
                }))
                .doOnEach(flowLogger.stage(ForecastFlowLogger.MODEL_COMPUTED))
                .flatMap(computed -> narrative(
                        NarrativePromptBuilder.forScenario(scenario, computed.results(), narrativeLanguage),
                        NarrativePromptBuilder.scenarioFallback(scenario, computed.results()), runId)
                    .flatMap(narrative -> persistAndComplete(runId, computed, narrative, params, years)));
        });

        return TraceContextUtil.withRunId(pipeline.onErrorResume(e -> markFailed(runId, e)), runId);
    }

    // ── Year windows ───────────────────────────────────────────────

    /** Explicit years when given, else the three previous election cycles back to 2002. */
    static List<Integer> resolveYears(ForecastOptions options) {
        if (options.historicalYears() != null && !options.historicalYears().isEmpty()) {
            return List.copyOf(options.historicalYears());
        }
        return IntStream.rangeClosed(1, LOOKBACK_CYCLES)
            .map(i -> options.targetYear() - i * ELECTION_CYCLE_YEARS)
            .filter(y -> y >= MIN_HISTORICAL_YEAR)
            .boxed()
            .toList();
    }

    /** The base year and the two cycles before it, back to 2002. */
    static List<Integer> scenarioYears(int baseYear) {
        return IntStream.range(0, LOOKBACK_CYCLES)
            .map(i -> baseYear - i * ELECTION_CYCLE_YEARS)
            .filter(y -> y >= MIN_HISTORICAL_YEAR)
            .boxed()
            .toList();
    }

    // ── Stages ─────────────────────────────────────────────────────

    private Mono<ForecastRun> markRunning(long runId) {
        return forecastStore.updateForecastRun(runId, ForecastRunUpdate.running(now()))
            .doOnEach(flowLogger.stage(ForecastFlowLogger.RUN_STARTED));
    }

    private Mono<List<HistoricalDataPoint>> fetchHistory(long runId, List<Integer> years,
                                                         String position, String state) {
        return Mono.defer(() -> historicalDataSource.getHistoricalVotesByParty(years, position, state))
            .defaultIfEmpty(List.of())
            .flatMap(data -> {
                if (!data.isEmpty()) return Mono.just(data);
                log.warn("No historical data for run. runId={} years={} position={} state={}",
                    runId, years, position, state);
                return forecastStore.updateForecastRun(runId, ForecastRunUpdate.failed(now()))
                    .then(Mono.<List<HistoricalDataPoint>>error(new DataInsufficiencyException(runId, years)));
            })
            .doOnEach(flowLogger.stage(ForecastFlowLogger.HISTORY_FETCHED));
    }

    private Mono<ForecastRun> loadRun(long runId) {
        return forecastStore.getForecastRun(runId)
            .switchIfEmpty(Mono.error(() -> new ForecastRunNotFoundException(runId)));
    }

    private Mono<String> narrative(String prompt, String fallback, long runId) {
        return Mono.defer(() -> narrativeGenerator.generate(prompt))
            .filter(text -> !text.isBlank())
            .onErrorResume(e -> {
                log.warn("Narrative generation failed, using fallback. runId={} reason={}", runId, e.getMessage());
                return Mono.empty();
            })
            .defaultIfEmpty(fallback)
            .doOnEach(flowLogger.stage(ForecastFlowLogger.NARRATIVE_READY));
    }

    private Mono<ForecastSummary> persistAndComplete(long runId, Computation computed, String narrative,
                                                     ModelParameters params, List<Integer> years) {
        List<ForecastResultRecord> results = computed.results().stream().map(r -> r.withRunId(runId)).toList();
        List<SwingRegionRecord> swings = computed.swingRegions().stream().map(r -> r.withRunId(runId)).toList();

        return forecastStore.createForecastResults(results)
            .flatMap(savedResults -> forecastStore.createSwingRegions(swings)
                .map(savedSwings -> new ForecastSummary(savedResults, savedSwings, narrative)))
            .doOnEach(flowLogger.stage(ForecastFlowLogger.RESULTS_PERSISTED))
            .flatMap(summary -> forecastStore.updateForecastRun(runId, ForecastRunUpdate.completed(
                    now(), params.monteCarloIterations(), years, params, narrative))
                .thenReturn(summary))
            .doOnNext(summary -> flowLogger.logOutcome(runId,
                summary.partyResults().size(),
                summary.swingRegions().size(),
                summary.partyResults().isEmpty() ? "none" : summary.partyResults().get(0).entityName()));
    }

    private <T> Mono<T> markFailed(long runId, Throwable error) {
        flowLogger.logFailure(runId, error);
        if (error instanceof DataInsufficiencyException) {
            return Mono.error(error);
        }
        return forecastStore.updateForecastRun(runId, ForecastRunUpdate.failed(now()))
            .doOnError(e -> log.warn("Could not mark run failed. runId={} reason={}", runId, e.getMessage()))
            .onErrorResume(e -> Mono.empty())
            .then(Mono.<T>error(error));
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static <T> Mono<T> compute(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }

    private SplittableRandom newRandom(long runId) {
        return randomSeed == null ? new SplittableRandom() : new SplittableRandom(randomSeed ^ runId);
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private record Computation(List<ForecastResultRecord> results, List<SwingRegionRecord> swingRegions) {}
}
