package com.forecastplatform.orchestrator.client;

import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.ForecastRunUpdate;
import com.forecastplatform.common.model.SwingRegionRecord;
import com.forecastplatform.common.port.ForecastStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST-based implementation of {@link ForecastStore}.
 *
 * <p>Every call is non-blocking. Errors propagate to the orchestrator, which
 * decides whether the run fails; only a 404 on a run lookup is translated into
 * an empty result.
 */
@Component
public class ForecastStoreClient implements ForecastStore {

    private static final Logger log = LoggerFactory.getLogger(ForecastStoreClient.class);

    private static final ParameterizedTypeReference<List<ForecastResultRecord>> RESULT_LIST =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<SwingRegionRecord>> SWING_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient forecastStoreClient;

    public ForecastStoreClient(@Qualifier("forecastStoreClient") WebClient forecastStoreClient) {
        this.forecastStoreClient = forecastStoreClient;
    }

    @Override
    public Mono<ForecastRun> createForecastRun(ForecastRun run) {
        return forecastStoreClient.post()
            .uri("/api/v1/forecasts/runs")
            .bodyValue(run)
            .retrieve()
            .bodyToMono(ForecastRun.class)
            .doOnNext(saved -> log.info("Forecast run created. runId={} targetYear={} createdBy={}",
                                        saved.id(), saved.targetYear(), saved.createdBy()));
    }

    @Override
    public Mono<ForecastRun> getForecastRun(long runId) {
        return forecastStoreClient.get()
            .uri("/api/v1/forecasts/runs/{id}", runId)
            .retrieve()
            .bodyToMono(ForecastRun.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }

    @Override
    public Mono<ForecastRun> updateForecastRun(long runId, ForecastRunUpdate update) {
        return forecastStoreClient.patch()
            .uri("/api/v1/forecasts/runs/{id}", runId)
            .bodyValue(update)
            .retrieve()
            .bodyToMono(ForecastRun.class)
            .doOnNext(run -> log.debug("Forecast run updated. runId={} status={}", runId, run.status()));
    }

    @Override
    public Mono<List<ForecastResultRecord>> createForecastResults(List<ForecastResultRecord> results) {
        if (results.isEmpty()) return Mono.just(List.of());
        return forecastStoreClient.post()
            .uri("/api/v1/forecasts/results")
            .bodyValue(results)
            .retrieve()
            .bodyToMono(RESULT_LIST);
    }

    @Override
    public Mono<List<SwingRegionRecord>> createSwingRegions(List<SwingRegionRecord> regions) {
        if (regions.isEmpty()) return Mono.just(List.of());
        return forecastStoreClient.post()
            .uri("/api/v1/forecasts/swing-regions")
            .bodyValue(regions)
            .retrieve()
            .bodyToMono(SWING_LIST);
    }

    @Override
    public Mono<List<ForecastResultRecord>> getForecastResults(long runId) {
        return forecastStoreClient.get()
            .uri(uri -> uri.path("/api/v1/forecasts/runs/{id}/results")
                           .queryParam("resultType", "party")
                           .build(runId))
            .retrieve()
            .bodyToMono(RESULT_LIST)
            .defaultIfEmpty(List.of());
    }

    @Override
    public Mono<List<SwingRegionRecord>> getSwingRegions(long runId) {
        return forecastStoreClient.get()
            .uri("/api/v1/forecasts/runs/{id}/swing-regions", runId)
            .retrieve()
            .bodyToMono(SWING_LIST)
            .defaultIfEmpty(List.of());
    }
}
