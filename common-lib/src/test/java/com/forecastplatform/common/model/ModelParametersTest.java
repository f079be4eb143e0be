package com.forecastplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelParametersTest {

    @Nested
    @DisplayName("merge()")
    class MergeTests {

        @Test
        @DisplayName("only non-null overrides replace defaults")
        void partialOverride() {
            ModelParameters merged = ModelParameters.DEFAULTS.merge(
                new ModelParameterOverrides(500, null, null, null, 0.6, null));

            assertEquals(500, merged.monteCarloIterations());
            assertEquals(0.6, merged.trendWeight());
            assertEquals(0.95, merged.confidenceLevel());
            assertEquals(0.85, merged.historicalWeightDecay());
            assertEquals(0.15, merged.sentimentWeight());
            assertEquals(1.2, merged.volatilityMultiplier());
        }

        @Test
        @DisplayName("null overrides → same instance")
        void nullOverride() {
            assertSame(ModelParameters.DEFAULTS, ModelParameters.DEFAULTS.merge(null));
            assertEquals(ModelParameters.DEFAULTS, ModelParameters.DEFAULTS.merge(ModelParameterOverrides.none()));
        }

        @Test
        @DisplayName("invalid overrides are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> ModelParameters.DEFAULTS.merge(
                new ModelParameterOverrides(0, null, null, null, null, null)));
            assertThrows(IllegalArgumentException.class, () -> ModelParameters.DEFAULTS.merge(
                new ModelParameterOverrides(null, 1.5, null, null, null, null)));
        }
    }

    @Nested
    @DisplayName("ForecastRun.apply()")
    class RunUpdateTests {

        @Test
        @DisplayName("completion patch keeps identity fields and fills outcome fields")
        void completion() {
            Instant created = Instant.parse("2026-01-01T00:00:00Z");
            Instant started = Instant.parse("2026-01-01T00:00:05Z");
            Instant done = Instant.parse("2026-01-01T00:00:09Z");
            ForecastRun run = ForecastRun.pending("run", null, 2026, "governor", "SP", null,
                    null, ModelParameters.DEFAULTS, "alice", created)
                .withId(7L)
                .apply(ForecastRunUpdate.running(started))
                .apply(ForecastRunUpdate.completed(done, 10_000, List.of(2022, 2018),
                    ModelParameters.DEFAULTS, "text"));

            assertEquals(7L, run.id());
            assertEquals(RunStatus.COMPLETED, run.status());
            assertEquals(started, run.startedAt());
            assertEquals(done, run.completedAt());
            assertEquals(10_000, run.totalSimulations());
            assertEquals(List.of(2022, 2018), run.historicalYearsUsed());
            assertEquals("text", run.narrative());
            assertEquals("alice", run.createdBy());
        }
    }

    @Nested
    @DisplayName("Precision")
    class PrecisionTests {

        @Test
        @DisplayName("half-up rounding to 4 and 2 decimals")
        void rounding() {
            assertEquals(12.3457, Precision.fine(12.34565));
            assertEquals(0.13, Precision.coarse(0.125));
            assertEquals(0.0, Precision.fine(Double.NaN));
        }
    }
}
