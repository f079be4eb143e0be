package com.forecastplatform.common.model;

import java.util.List;

/**
 * Distribution summary of one Monte Carlo run. {@code samples} is sorted
 * ascending; {@code lower}/{@code upper} are the confidence-bound percentiles
 * picked from it. Transient: consumed by the forecast generators, never persisted.
 */
public record MonteCarloResult(
    List<Double> samples,
    double mean,
    double median,
    double lower,
    double upper,
    double standardDeviation
) {}
