package com.forecastplatform.common.scenario;

import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.VoteShare;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioAdjusterTest {

    private static Map<String, PartyTrendData> baseTrends() {
        Map<String, PartyTrendData> trends = new LinkedHashMap<>();
        trends.put("A", new PartyTrendData("A",
            List.of(new VoteShare(2018, 100, 30.0), new VoteShare(2022, 100, 40.0)), 2.5, 7.07, 0.33));
        trends.put("B", new PartyTrendData("B",
            List.of(new VoteShare(2018, 100, 20.0), new VoteShare(2022, 100, 10.0)), -2.5, 7.07, -0.5));
        return trends;
    }

    private static PredictionScenario scenario(List<PollingData> polls,
                                               Map<String, PartyAdjustment> adjustments,
                                               List<ExternalFactor> factors) {
        return new PredictionScenario(1L, "what-if", 2022, 2026, null, null,
            polls, null, adjustments, factors, null, null, null, null, null);
    }

    @Nested
    @DisplayName("adjust()")
    class AdjustTests {

        @Test
        @DisplayName("poll blend replaces only the latest share")
        void pollBlend() {
            Map<String, PartyTrendData> adjusted = ScenarioAdjuster.adjust(baseTrends(),
                scenario(List.of(new PollingData("A", 50.0, "poll")), null, null));

            List<VoteShare> a = adjusted.get("A").historicalVotes();
            assertEquals(30.0, a.get(0).share(), 1e-9);
            assertEquals(40.0 * 0.7 + 50.0 * 0.3, a.get(1).share(), 1e-9);
            assertEquals(2.5, adjusted.get("A").trendSlope());
            assertEquals(10.0, adjusted.get("B").latest().share(), 1e-9);
        }

        @Test
        @DisplayName("manual adjustment is added after the poll blend")
        void adjustmentAfterBlend() {
            Map<String, PartyTrendData> adjusted = ScenarioAdjuster.adjust(baseTrends(),
                scenario(List.of(new PollingData("A", 50.0, null)),
                    Map.of("A", new PartyAdjustment(-3.0, "scandal")), null));
            assertEquals(43.0 - 3.0, adjusted.get("A").latest().share(), 1e-9);
        }

        @Test
        @DisplayName("unknown parties are ignored and inputs are not mutated")
        void unknownParty() {
            Map<String, PartyTrendData> input = baseTrends();
            Map<String, PartyTrendData> adjusted = ScenarioAdjuster.adjust(input,
                scenario(List.of(new PollingData("Z", 90.0, null)),
                    Map.of("B", new PartyAdjustment(5.0, "alliance")), null));

            assertEquals(2, adjusted.size());
            assertEquals(15.0, adjusted.get("B").latest().share(), 1e-9);
            assertEquals(10.0, input.get("B").latest().share(), 1e-9);
        }
    }

    @Nested
    @DisplayName("volatilityMultiplier()")
    class MultiplierTests {

        @Test
        @DisplayName("positive factors raise, negative lower the multiplier")
        void signedImpact() {
            double m = ScenarioAdjuster.volatilityMultiplier(1.2, List.of(
                new ExternalFactor("economy", "positive", 50),
                new ExternalFactor("debate", "negative", 10)));
            assertEquals(1.2 + (0.5 - 0.1) * 0.1, m, 1e-12);
        }

        @Test
        @DisplayName("floored at 0.1")
        void floor() {
            assertEquals(0.1, ScenarioAdjuster.volatilityMultiplier(0.2,
                List.of(new ExternalFactor("crisis", "negative", 1000))), 1e-12);
        }

        @Test
        @DisplayName("no factors → unchanged")
        void none() {
            assertEquals(1.2, ScenarioAdjuster.volatilityMultiplier(1.2, List.of()));
        }
    }

    @Nested
    @DisplayName("PredictionScenario defaults")
    class DefaultTests {

        @Test
        @DisplayName("absent settings fall back to the scenario defaults")
        void defaults() {
            PredictionScenario s = scenario(null, null, null);
            assertEquals(0.30, s.pollingWeight());
            assertEquals(10_000, s.monteCarloIterations());
            assertEquals(0.95, s.confidenceLevel());
            assertEquals(1.20, s.baseParameters().volatilityMultiplier());
            assertEquals(0.50, s.baseParameters().trendWeight());
            assertEquals(0.20, s.baseParameters().sentimentWeight());
            assertTrue(s.isNational());
            assertTrue(s.pollingData().isEmpty());
        }

        @Test
        @DisplayName("null party adjustments are dropped, the rest still apply")
        void nullAdjustmentDropped() {
            Map<String, PartyAdjustment> adjustments = new HashMap<>();
            adjustments.put("A", null);
            adjustments.put("B", new PartyAdjustment(5.0, "new candidate"));

            PredictionScenario s = scenario(null, adjustments, null);
            assertEquals(Map.of("B", new PartyAdjustment(5.0, "new candidate")), s.partyAdjustments());

            Map<String, PartyTrendData> adjusted = ScenarioAdjuster.adjust(baseTrends(), s);
            assertEquals(40.0, adjusted.get("A").latest().share(), 1e-9);
            assertEquals(15.0, adjusted.get("B").latest().share(), 1e-9);
        }
    }
}
