package com.forecastplatform.common.swing;

/**
 * Cut-offs used to decide whether a region is a swing region and how its key
 * factors are rated.
 *
 * @param maxSwingMargin       margin (percentage points) below which a race is close enough
 * @param minSwingVolatility   average volatility above which a race is volatile enough
 * @param tightMargin          margin below which "Tight margin" is rated high
 * @param highVolatility       average volatility above which "High historical volatility" is rated high
 * @param uncertaintyVolatility volatility scale of the outcome-uncertainty formula
 */
public record SwingThresholds(
    double maxSwingMargin,
    double minSwingVolatility,
    double tightMargin,
    double highVolatility,
    double uncertaintyVolatility
) {
    public static final SwingThresholds DEFAULTS = new SwingThresholds(10.0, 2.0, 5.0, 5.0, 5.0);

    public SwingThresholds {
        if (!(maxSwingMargin > 0.0)) {
            throw new IllegalArgumentException("maxSwingMargin must be > 0, got " + maxSwingMargin);
        }
        if (!(uncertaintyVolatility > 0.0)) {
            throw new IllegalArgumentException("uncertaintyVolatility must be > 0, got " + uncertaintyVolatility);
        }
        if (!(minSwingVolatility >= 0.0 && tightMargin >= 0.0 && highVolatility >= 0.0)) {
            throw new IllegalArgumentException("swing thresholds must be >= 0, got minSwingVolatility="
                + minSwingVolatility + " tightMargin=" + tightMargin + " highVolatility=" + highVolatility);
        }
    }
}
