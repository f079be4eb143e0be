package com.forecastplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastplatform.common.model.ModelParameters;
import com.forecastplatform.common.swing.SwingThresholds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${services.forecast-store.base-url}")
    private String forecastStoreUrl;

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.baseUrl(historyUrl).build();
    }

    @Bean
    public WebClient forecastStoreClient(WebClient.Builder builder) {
        return builder.baseUrl(forecastStoreUrl).build();
    }

    /** Defaults every run starts from; request overrides are merged on top. */
    @Bean
    public ModelParameters defaultModelParameters(
            @Value("${forecast.model.monte-carlo-iterations:10000}") int iterations,
            @Value("${forecast.model.confidence-level:0.95}") double confidenceLevel,
            @Value("${forecast.model.historical-weight-decay:0.85}") double historicalWeightDecay,
            @Value("${forecast.model.sentiment-weight:0.15}") double sentimentWeight,
            @Value("${forecast.model.trend-weight:0.4}") double trendWeight,
            @Value("${forecast.model.volatility-multiplier:1.2}") double volatilityMultiplier) {
        return new ModelParameters(iterations, confidenceLevel, historicalWeightDecay,
            sentimentWeight, trendWeight, volatilityMultiplier);
    }

    @Bean
    public SwingThresholds swingThresholds(
            @Value("${forecast.swing.max-margin:10.0}") double maxMargin,
            @Value("${forecast.swing.min-volatility:2.0}") double minVolatility,
            @Value("${forecast.swing.tight-margin:5.0}") double tightMargin,
            @Value("${forecast.swing.high-volatility:5.0}") double highVolatility,
            @Value("${forecast.swing.uncertainty-volatility:5.0}") double uncertaintyVolatility) {
        return new SwingThresholds(maxMargin, minVolatility, tightMargin, highVolatility, uncertaintyVolatility);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
