package com.forecastplatform.orchestrator.service;

import com.forecastplatform.common.model.ForecastOptions;
import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.HistoricalTrend;
import com.forecastplatform.common.model.ModelParameterOverrides;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.model.RunStatus;
import com.forecastplatform.common.model.RunSummary;
import com.forecastplatform.common.model.TrendDirection;
import com.forecastplatform.common.port.ForecastStore;
import com.forecastplatform.common.scenario.PredictionScenario;
import com.forecastplatform.orchestrator.dto.CreateForecastRequest;
import com.forecastplatform.orchestrator.dto.ScenarioForecastRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ForecastRunLauncher")
class ForecastRunLauncherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ForecastStore forecastStore;

    @Mock
    private ForecastOrchestrator orchestrator;

    private ForecastRunLauncher launcher;

    @BeforeEach
    void setUp() {
        launcher = new ForecastRunLauncher(forecastStore, orchestrator, ModelParameters.DEFAULTS,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("createAndRun returns the pending run without waiting for the forecast")
    void createReturnsPendingRun() {
        when(forecastStore.createForecastRun(any(ForecastRun.class)))
            .thenAnswer(inv -> Mono.just(((ForecastRun) inv.getArgument(0)).withId(11L)));
        when(orchestrator.runForecast(eq(11L), any(ForecastOptions.class))).thenReturn(Mono.never());

        CreateForecastRequest request = new CreateForecastRequest(null, "first pass", 2026, "governor",
            "SP", null, null, new ModelParameterOverrides(2000, null, null, null, null, null));

        ForecastRun run = launcher.createAndRun("analyst-1", request).block();

        assertThat(run).isNotNull();
        assertThat(run.id()).isEqualTo(11L);
        assertThat(run.status()).isEqualTo(RunStatus.PENDING);

        ArgumentCaptor<ForecastRun> created = ArgumentCaptor.forClass(ForecastRun.class);
        verify(forecastStore).createForecastRun(created.capture());
        assertThat(created.getValue().name()).isEqualTo("Forecast 2026");
        assertThat(created.getValue().createdBy()).isEqualTo("analyst-1");
        assertThat(created.getValue().createdAt()).isEqualTo(NOW);
        assertThat(created.getValue().modelParameters().monteCarloIterations()).isEqualTo(2000);

        ArgumentCaptor<ForecastOptions> options = ArgumentCaptor.forClass(ForecastOptions.class);
        verify(orchestrator, timeout(2000)).runForecast(eq(11L), options.capture());
        assertThat(options.getValue().targetState()).isEqualTo("SP");
    }

    @Test
    @DisplayName("background failure is not surfaced to the caller")
    void backgroundFailureSwallowed() {
        when(forecastStore.createForecastRun(any(ForecastRun.class)))
            .thenAnswer(inv -> Mono.just(((ForecastRun) inv.getArgument(0)).withId(12L)));
        when(orchestrator.runForecast(eq(12L), any(ForecastOptions.class)))
            .thenReturn(Mono.error(new IllegalStateException("boom")));

        ForecastRun run = launcher.createAndRun("system",
            new CreateForecastRequest("Named", null, 2026, null, null, null, null, null)).block();

        assertThat(run.name()).isEqualTo("Named");
        verify(orchestrator, timeout(2000)).runForecast(eq(12L), any(ForecastOptions.class));
    }

    @Test
    @DisplayName("createAndRunScenario names the run after the scenario")
    void scenarioRun() {
        PredictionScenario scenario = new PredictionScenario(4L, "Runoff", 2022, 2026, "RJ", "governor",
            null, null, null, null, 1000, null, null, null, null);
        when(forecastStore.createForecastRun(any(ForecastRun.class)))
            .thenAnswer(inv -> Mono.just(((ForecastRun) inv.getArgument(0)).withId(13L)));
        when(orchestrator.runScenario(13L, scenario)).thenReturn(Mono.never());

        ForecastRun run = launcher.createAndRunScenario("system",
            new ScenarioForecastRequest("what if", scenario)).block();

        assertThat(run.name()).isEqualTo("Runoff");
        assertThat(run.targetState()).isEqualTo("RJ");
        assertThat(run.modelParameters().monteCarloIterations()).isEqualTo(1000);
        verify(orchestrator, timeout(2000)).runScenario(13L, scenario);
    }

    @Test
    @DisplayName("createAndRunScenario without a scenario is rejected")
    void scenarioRequired() {
        assertThatThrownBy(() -> launcher.createAndRunScenario("system",
                new ScenarioForecastRequest("nothing", null)).block())
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(forecastStore, orchestrator);
    }

    @Test
    @DisplayName("getSummary keeps the top ten party results")
    void summaryLimitsParties() {
        ForecastRun run = ForecastRun.pending("r", null, 2026, null, null, null, null,
            ModelParameters.DEFAULTS, "system", NOW).withId(5L);
        List<ForecastResultRecord> results = IntStream.range(0, 12)
            .mapToObj(i -> result("P" + i, 40.0 - i))
            .toList();
        when(forecastStore.getForecastRun(5L)).thenReturn(Mono.just(run));
        when(forecastStore.getForecastResults(5L)).thenReturn(Mono.just(results));
        when(forecastStore.getSwingRegions(5L)).thenReturn(Mono.just(List.of()));

        RunSummary summary = launcher.getSummary(5L).block();

        assertThat(summary.run()).isEqualTo(run);
        assertThat(summary.topParties()).hasSize(10);
        assertThat(summary.topParties().get(0).entityName()).isEqualTo("P0");
        assertThat(summary.swingRegions()).isEmpty();
    }

    @Test
    @DisplayName("getSummary is empty for an unknown run")
    void summaryUnknownRun() {
        when(forecastStore.getForecastRun(99L)).thenReturn(Mono.empty());

        assertThat(launcher.getSummary(99L).blockOptional()).isEmpty();
        verify(forecastStore, never()).getForecastResults(99L);
    }

    private static ForecastResultRecord result(String party, double share) {
        return new ForecastResultRecord(5L, "party", party, null, share, share - 2, share + 2,
            HistoricalTrend.of(List.of()), TrendDirection.STABLE, 0.0, 0.8, List.of());
    }
}
