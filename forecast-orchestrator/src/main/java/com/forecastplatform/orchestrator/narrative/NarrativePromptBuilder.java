package com.forecastplatform.orchestrator.narrative;

import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.SwingRegionRecord;
import com.forecastplatform.common.scenario.ExternalFactor;
import com.forecastplatform.common.scenario.PollingData;
import com.forecastplatform.common.scenario.PredictionScenario;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders the prompts sent to the narrative generator, and the sentences used
 * when it cannot answer. Pure string formatting; numbers use one decimal.
 */
public final class NarrativePromptBuilder {

    static final int TOP_PARTIES = 5;
    static final int TOP_SWING_REGIONS = 3;
    static final int FALLBACK_PARTIES = 3;

    public static final String FALLBACK_NARRATIVE =
        "Narrative analysis could not be generated. Please refer to the quantitative results.";

    private NarrativePromptBuilder() {}

    public static String forRun(ForecastRun run,
                                List<ForecastResultRecord> results,
                                List<SwingRegionRecord> swingRegions,
                                String language) {
        StringBuilder prompt = new StringBuilder()
            .append("You are a political analyst specialised in electoral forecasting.\n")
            .append("Always answer in ").append(language).append(".\n")
            .append("Based on the following forecast for the year ").append(run.targetYear())
            .append(", write a concise narrative analysis (3-4 paragraphs).\n\n")
            .append("Party forecasts (top ").append(TOP_PARTIES).append("):\n");

        results.stream().limit(TOP_PARTIES).forEach(p -> prompt
            .append("- ").append(p.entityName()).append(": ").append(pct(p.predictedVoteShare()))
            .append(" (CI: ").append(pct(p.voteShareLower())).append(" - ").append(pct(p.voteShareUpper()))
            .append("), trend: ").append(p.trendDirection().label()).append('\n'));

        prompt.append("\nSwing regions:\n");
        swingRegions.stream().limit(TOP_SWING_REGIONS).forEach(r -> prompt
            .append("- ").append(r.regionName()).append(": margin ").append(r.marginPercent())
            .append("% between ").append(r.leadingEntity()).append(" and ").append(r.challengingEntity())
            .append(", volatility ").append(r.volatilityScore()).append('\n'));

        prompt.append("\nPosition: ").append(orDefault(run.targetPosition(), "General")).append('\n')
              .append("State: ").append(orDefault(run.targetState(), "National")).append("\n\n")
              .append("Cover:\n")
              .append("1. The overall competitive landscape\n")
              .append("2. Main risks and uncertainties\n")
              .append("3. Regions decisive for the outcome\n")
              .append("4. Strategic recommendations\n");
        return prompt.toString();
    }

    public static String forScenario(PredictionScenario scenario,
                                     List<ForecastResultRecord> results,
                                     String language) {
        StringBuilder prompt = new StringBuilder()
            .append("You are a political analyst specialised in elections. Always answer in ")
            .append(language).append(".\n\n")
            .append("Electoral forecast for ").append(scenario.targetYear()).append(":\n")
            .append("Scenario: ").append(scenario.name()).append('\n')
            .append("Based on historical data up to ").append(scenario.baseYear()).append('\n')
            .append(scenario.isNational() ? "Scope: National" : "State: " + scenario.state()).append("\n\n")
            .append("Leading parties:\n");

        for (int i = 0; i < Math.min(TOP_PARTIES, results.size()); i++) {
            ForecastResultRecord p = results.get(i);
            prompt.append(i + 1).append(". ").append(p.entityName()).append(": ")
                  .append(pct(p.predictedVoteShare()))
                  .append(" (CI: ").append(pct(p.voteShareLower())).append("-")
                  .append(pct(p.voteShareUpper())).append(")\n");
        }

        if (!scenario.pollingData().isEmpty()) {
            prompt.append("\nPolls incorporated:\n");
            for (PollingData poll : scenario.pollingData()) {
                prompt.append("- ").append(poll.party()).append(": ").append(poll.pollPercent())
                      .append("% (").append(orDefault(poll.source(), "poll")).append(")\n");
            }
        }

        if (!scenario.externalFactors().isEmpty()) {
            prompt.append("\nExternal factors considered:\n");
            for (ExternalFactor factor : scenario.externalFactors()) {
                prompt.append("- ").append(factor.factor()).append(": ").append(factor.impact())
                      .append(" impact (magnitude ").append(factor.magnitude()).append(")\n");
            }
        }

        prompt.append("\nWrite a 2-3 paragraph narrative about these forecasts, considering the ")
              .append("historical context and the factors built into the scenario.");
        return prompt.toString();
    }

    /** Fallback for scenario runs: names the leading parties with their shares. */
    public static String scenarioFallback(PredictionScenario scenario, List<ForecastResultRecord> results) {
        String leaders = results.stream()
            .limit(FALLBACK_PARTIES)
            .map(p -> p.entityName() + " (" + pct(p.predictedVoteShare()) + ")")
            .collect(Collectors.joining(", "));
        return "Forecast for " + scenario.targetYear() + " based on scenario \"" + scenario.name()
            + "\". Top " + FALLBACK_PARTIES + " parties: " + leaders + ".";
    }

    static String pct(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
