package com.forecastplatform.common.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A qualitative event expected to affect the race (e.g. an economic shock).
 * {@code impact} is {@code "positive"} or {@code "negative"}; any other value
 * counts as negative.
 */
public record ExternalFactor(
    @JsonProperty("factor")    String factor,
    @JsonProperty("impact")    String impact,
    @JsonProperty("magnitude") double magnitude
) {
    public static final String POSITIVE = "positive";

    public boolean isPositive() {
        return POSITIVE.equals(impact);
    }
}
