package com.forecastplatform.common.scenario;

import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.model.PartyTrendData;
import com.forecastplatform.common.model.VoteShare;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioForecastGeneratorTest {

    private static final ModelParameters PARAMS = new ModelParameters(2_000, 0.95, 0.85, 0.2, 0.5, 1.2);

    private static Map<String, PartyTrendData> trends() {
        Map<String, PartyTrendData> trends = new LinkedHashMap<>();
        trends.put("A", new PartyTrendData("A", List.of(new VoteShare(2022, 0, 30.0)), 0.0, 0.0, 0.0));
        trends.put("B", new PartyTrendData("B", List.of(new VoteShare(2022, 0, 10.0)), 0.0, 0.0, 0.0));
        trends.put("C", new PartyTrendData("C",
            List.of(new VoteShare(2018, 0, 8.0), new VoteShare(2022, 0, 12.0)), 1.0, 2.83, 0.5));
        return trends;
    }

    @Test
    @DisplayName("predicted shares are normalised to sum to 100")
    void normalised() {
        List<ForecastResultRecord> results = ScenarioForecastGenerator.generate(
            trends(), PARAMS, null, new SplittableRandom(3));

        double total = results.stream().mapToDouble(ForecastResultRecord::predictedVoteShare).sum();
        assertEquals(100.0, total, 1e-3);
        assertEquals(3, results.size());
    }

    @Test
    @DisplayName("noise-free parties keep their relative proportions")
    void proportions() {
        Map<String, PartyTrendData> two = new LinkedHashMap<>();
        two.put("A", trends().get("A"));
        two.put("B", trends().get("B"));

        List<ForecastResultRecord> results = ScenarioForecastGenerator.generate(
            two, PARAMS, "SP", new SplittableRandom(3));

        assertEquals("A", results.get(0).entityName());
        assertEquals(75.0, results.get(0).predictedVoteShare(), 1e-9);
        assertEquals(25.0, results.get(1).predictedVoteShare(), 1e-9);
        assertEquals("SP", results.get(0).region());
    }

    @Test
    @DisplayName("slope shifts the latest share once before normalisation")
    void slopeAdjustment() {
        Map<String, PartyTrendData> two = new LinkedHashMap<>();
        two.put("A", new PartyTrendData("A", List.of(new VoteShare(2022, 0, 30.0)), 10.0, 0.0, 0.0));
        two.put("B", new PartyTrendData("B", List.of(new VoteShare(2022, 0, 10.0)), 0.0, 0.0, 0.0));

        List<ForecastResultRecord> results = ScenarioForecastGenerator.generate(
            two, PARAMS, null, new SplittableRandom(3));

        // 40 vs 10
        assertEquals(80.0, results.get(0).predictedVoteShare(), 1e-9);
        assertEquals(20.0, results.get(1).predictedVoteShare(), 1e-9);
    }

    @Test
    @DisplayName("all-zero field → factor 1, no division by zero")
    void zeroTotal() {
        assertEquals(1.0, ScenarioForecastGenerator.normalizationFactor(0.0));
        Map<String, PartyTrendData> zero = Map.of("A",
            new PartyTrendData("A", List.of(new VoteShare(2022, 0, 0.0)), 0.0, 0.0, 0.0));
        List<ForecastResultRecord> results = ScenarioForecastGenerator.generate(
            zero, PARAMS, null, new SplittableRandom(3));
        assertEquals(0.0, results.get(0).predictedVoteShare());
    }
}
