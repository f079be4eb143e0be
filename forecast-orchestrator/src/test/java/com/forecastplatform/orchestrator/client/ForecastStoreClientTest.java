package com.forecastplatform.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.model.ForecastResultRecord;
import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.ForecastRunUpdate;
import com.forecastplatform.common.model.HistoricalTrend;
import com.forecastplatform.common.model.RunStatus;
import com.forecastplatform.common.model.SwingRegionRecord;
import com.forecastplatform.common.model.TrendDirection;
import com.forecastplatform.orchestrator.config.OrchestratorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForecastStoreClientTest {

    /** Same mapper the application registers, so decoding matches the running service. */
    private final ObjectMapper objectMapper = new OrchestratorConfig().objectMapper();
    private final AtomicInteger calls = new AtomicInteger();

    private ForecastStoreClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://store.test")
            .codecs(codecs -> {
                codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
            })
            .exchangeFunction(request -> {
                calls.incrementAndGet();
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new ForecastStoreClient(webClient);
    }

    private static ForecastResultRecord result(String party) {
        return new ForecastResultRecord(5L, "party", party, null, 41.5, 35.0, 48.0,
            HistoricalTrend.of(List.of()), TrendDirection.RISING, 0.75, 0.9, List.of());
    }

    @Test
    @DisplayName("persisted results decode even with store-only columns")
    void createdResultsWithStoreColumns() {
        ForecastStoreClient client = client(HttpStatus.OK, """
            [{"id":1,"runId":5,"resultType":"party","entityId":null,"entityName":"A","region":null,
              "predictedVoteShare":41.5,"voteShareLower":35.0,"voteShareUpper":48.0,
              "historicalTrend":{"years":[2022],"voteShares":[40.0]},"trendDirection":"rising",
              "trendStrength":0.75,"confidence":0.9,
              "influenceFactors":[{"factor":"Historical trend","weight":0.4,"impact":"rising"}],
              "createdAt":"2026-03-01T12:00:00Z"}]
            """);

        List<ForecastResultRecord> saved = client.createForecastResults(List.of(result("A"))).block();

        assertThat(saved).hasSize(1);
        assertThat(saved.get(0).runId()).isEqualTo(5L);
        assertThat(saved.get(0).trendDirection()).isEqualTo(TrendDirection.RISING);
        assertThat(saved.get(0).historicalTrend().years()).containsExactly(2022);
    }

    @Test
    @DisplayName("persisted swing regions decode even with store-only columns")
    void createdSwingRegionsWithStoreColumns() {
        ForecastStoreClient client = client(HttpStatus.OK, """
            [{"id":9,"runId":5,"region":"SP","regionName":"São Paulo","position":"governor",
              "marginPercent":2.5,"marginVotes":20,"volatilityScore":9.44,"swingMagnitude":11.33,
              "leadingEntity":"A","challengingEntity":"B","sentimentBalance":"0",
              "recentTrendShift":1.2,"outcomeUncertainty":1.0,
              "keyFactors":[{"factor":"Tight margin","impact":"high","source":"model"}],
              "createdAt":"2026-03-01T12:00:00Z"}]
            """);
        SwingRegionRecord region = new SwingRegionRecord(5L, "SP", "São Paulo", "governor", 2.5, 20,
            9.44, 11.33, "A", "B", "0", 1.2, 1.0, List.of());

        List<SwingRegionRecord> saved = client.createSwingRegions(List.of(region)).block();

        assertThat(saved).hasSize(1);
        assertThat(saved.get(0).keyFactors().get(0).impact()).isEqualTo("high");
    }

    @Test
    @DisplayName("run rows decode even with store-only columns")
    void runWithStoreColumns() {
        ForecastStoreClient client = client(HttpStatus.OK, """
            {"id":5,"name":"Forecast 2026","targetYear":2026,"status":"running",
             "startedAt":"2026-03-01T12:00:00Z","sentimentData":{"A":0.1},
             "modelParameters":{"monteCarloIterations":10000,"confidenceLevel":0.95,
               "historicalWeightDecay":0.85,"sentimentWeight":0.15,"trendWeight":0.4,
               "volatilityMultiplier":1.2,"seed":null},
             "createdBy":"analyst","createdAt":"2026-03-01T11:59:00Z","updatedAt":"2026-03-01T12:00:00Z"}
            """);

        ForecastRun run = client.updateForecastRun(5L, ForecastRunUpdate.running(Instant.now())).block();

        assertThat(run.id()).isEqualTo(5L);
        assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.startedAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
        assertThat(run.modelParameters().monteCarloIterations()).isEqualTo(10000);
    }

    @Test
    @DisplayName("unknown run → empty")
    void runNotFound() {
        assertThat(client(HttpStatus.NOT_FOUND, "{}").getForecastRun(3L).blockOptional()).isEmpty();
    }

    @Test
    @DisplayName("other lookup failures propagate")
    void lookupFailure() {
        ForecastStoreClient client = client(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        assertThatThrownBy(() -> client.getForecastRun(3L).block())
            .isInstanceOf(WebClientResponseException.class);
    }

    @Test
    @DisplayName("empty batches are not sent")
    void emptyBatches() {
        ForecastStoreClient client = client(HttpStatus.OK, "[]");

        assertThat(client.createForecastResults(List.of()).block()).isEmpty();
        assertThat(client.createSwingRegions(List.of()).block()).isEmpty();
        assertThat(calls.get()).isZero();
    }
}
