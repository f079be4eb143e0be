package com.forecastplatform.orchestrator.client;

import com.forecastplatform.common.model.HistoricalDataPoint;
import com.forecastplatform.common.port.HistoricalDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches historical per-party vote tallies from the history service.
 *
 * <p>Unlike optional lookups, a failure here is fatal for the run, so errors
 * are logged and propagated rather than replaced by a fallback.
 */
@Component
public class HistoricalDataClient implements HistoricalDataSource {

    private static final Logger log = LoggerFactory.getLogger(HistoricalDataClient.class);

    private final WebClient historyClient;

    public HistoricalDataClient(@Qualifier("historyClient") WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public Mono<List<HistoricalDataPoint>> getHistoricalVotesByParty(List<Integer> years,
                                                                     String position,
                                                                     String state) {
        return historyClient.get()
            .uri(uri -> {
                uri.path("/api/v1/history/votes-by-party");
                years.forEach(y -> uri.queryParam("years", y));
                if (position != null && !position.isBlank()) uri.queryParam("position", position);
                if (state != null && !state.isBlank()) uri.queryParam("state", state);
                return uri.build();
            })
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<List<HistoricalDataPoint>>() {})
            .defaultIfEmpty(List.of())
            .doOnNext(rows -> log.debug("Historical votes fetched. rows={} years={} position={} state={}",
                                        rows.size(), years, position, state))
            .doOnError(e -> log.error("Historical votes fetch failed. years={} position={} state={} reason={}",
                                      years, position, state, e.getMessage()));
    }
}
